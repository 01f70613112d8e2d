package uk.ac.ntu.chunkfs.common.http;

import uk.ac.ntu.chunkfs.common.error.ErrorCode;
import uk.ac.ntu.chunkfs.common.error.FsException;
import uk.ac.ntu.chunkfs.common.rpc.AppendResult;
import uk.ac.ntu.chunkfs.common.rpc.ChunkAllocation;
import uk.ac.ntu.chunkfs.common.rpc.ChunkLocations;
import uk.ac.ntu.chunkfs.common.rpc.FileInfo;
import uk.ac.ntu.chunkfs.common.rpc.LeaseGrant;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Text encoding used by the HTTP carrier: one {@code key=value} pair per line, lists
 * comma-separated, failures as {@code ERR <CODE> <message>}.
 */
public final class Wire {
    private static final String ERR = "ERR ";

    private Wire() {}

    // ---------------- primitives ----------------

    public static String lines(Map<String, String> kv) {
        StringBuilder sb = new StringBuilder();
        for (var e : kv.entrySet()) sb.append(e.getKey()).append('=').append(e.getValue()).append('\n');
        return sb.toString();
    }

    public static Map<String, String> parse(String body) {
        Map<String, String> out = new LinkedHashMap<>();
        if (body == null) return out;
        for (String line : body.split("\n")) {
            int i = line.indexOf('=');
            if (i <= 0) continue;
            out.put(line.substring(0, i).trim(), line.substring(i + 1).trim());
        }
        return out;
    }

    public static String joinIds(Collection<String> ids) { return String.join(",", ids); }

    public static String joinHandles(Collection<Long> handles) {
        return handles.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    public static List<String> splitIds(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String part : raw.split(",")) {
            String p = part.trim();
            if (!p.isEmpty()) out.add(p);
        }
        return out;
    }

    public static List<Long> splitHandles(String raw) {
        List<Long> out = new ArrayList<>();
        for (String id : splitIds(raw)) out.add(Long.parseLong(id));
        return out;
    }

    public static String enc(String s) {
        return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8);
    }

    public static String queryParam(String rawQuery, String key) {
        if (rawQuery == null) return null;
        for (String part : rawQuery.split("&")) {
            String[] kv = part.split("=", 2);
            if (kv.length == 2 && kv[0].equals(key)) return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
        }
        return null;
    }

    // ---------------- errors ----------------

    public static String error(FsException e) {
        return ERR + e.code().name() + " " + (e.getMessage() == null ? "" : e.getMessage());
    }

    /** Turns an error body back into the exception it was written from. */
    public static FsException parseError(int status, String body) {
        String b = body == null ? "" : body.trim();
        if (b.startsWith(ERR)) {
            String rest = b.substring(ERR.length());
            int sp = rest.indexOf(' ');
            String code = sp < 0 ? rest : rest.substring(0, sp);
            String msg = sp < 0 ? "" : rest.substring(sp + 1);
            try {
                return new FsException(ErrorCode.valueOf(code), msg);
            } catch (IllegalArgumentException ignored) {
                // unknown code, fall through
            }
        }
        return new FsException(ErrorCode.UNREACHABLE, "unexpected reply " + status + " " + b);
    }

    // ---------------- values ----------------

    public static String encode(FileInfo info) {
        Map<String, String> kv = new LinkedHashMap<>();
        kv.put("path", enc(info.path()));
        kv.put("chunks", joinHandles(info.chunkHandles()));
        return lines(kv);
    }

    public static FileInfo decodeFileInfo(String body) throws FsException {
        Map<String, String> kv = parse(body);
        try {
            return new FileInfo(
                    URLDecoder.decode(require(kv, "path"), StandardCharsets.UTF_8),
                    splitHandles(kv.get("chunks")));
        } catch (RuntimeException e) {
            throw malformed(body, e);
        }
    }

    public static String encode(ChunkAllocation a) {
        Map<String, String> kv = new LinkedHashMap<>();
        kv.put("handle", String.valueOf(a.handle()));
        kv.put("replicas", joinIds(a.replicas()));
        return lines(kv);
    }

    public static ChunkAllocation decodeAllocation(String body) throws FsException {
        Map<String, String> kv = parse(body);
        try {
            return new ChunkAllocation(Long.parseLong(require(kv, "handle")), splitIds(kv.get("replicas")));
        } catch (RuntimeException e) {
            throw malformed(body, e);
        }
    }

    public static String encode(LeaseGrant g) {
        Map<String, String> kv = new LinkedHashMap<>();
        kv.put("handle", String.valueOf(g.handle()));
        kv.put("primary", g.primary());
        kv.put("secondaries", joinIds(g.secondaries()));
        kv.put("version", String.valueOf(g.version()));
        kv.put("expiry", String.valueOf(g.expiry().toEpochMilli()));
        return lines(kv);
    }

    public static LeaseGrant decodeLease(String body) throws FsException {
        Map<String, String> kv = parse(body);
        try {
            return new LeaseGrant(
                    Long.parseLong(require(kv, "handle")),
                    require(kv, "primary"),
                    splitIds(kv.get("secondaries")),
                    Long.parseLong(require(kv, "version")),
                    Instant.ofEpochMilli(Long.parseLong(require(kv, "expiry"))));
        } catch (RuntimeException e) {
            throw malformed(body, e);
        }
    }

    public static String encode(ChunkLocations l) {
        Map<String, String> kv = new LinkedHashMap<>();
        kv.put("handle", String.valueOf(l.handle()));
        kv.put("version", String.valueOf(l.version()));
        kv.put("replicas", joinIds(l.replicas()));
        kv.put("alive", joinIds(l.aliveReplicas()));
        kv.put("primary", l.primary() == null ? "" : l.primary());
        return lines(kv);
    }

    public static ChunkLocations decodeLocations(String body) throws FsException {
        Map<String, String> kv = parse(body);
        try {
            String primary = kv.get("primary");
            return new ChunkLocations(
                    Long.parseLong(require(kv, "handle")),
                    Long.parseLong(require(kv, "version")),
                    splitIds(kv.get("replicas")),
                    splitIds(kv.get("alive")),
                    primary == null || primary.isBlank() ? null : primary);
        } catch (RuntimeException e) {
            throw malformed(body, e);
        }
    }

    public static String encode(AppendResult r) {
        Map<String, String> kv = new LinkedHashMap<>();
        kv.put("handle", String.valueOf(r.handle()));
        kv.put("offset", String.valueOf(r.offset()));
        kv.put("size", String.valueOf(r.chunkSize()));
        return lines(kv);
    }

    public static AppendResult decodeAppend(String body) throws FsException {
        Map<String, String> kv = parse(body);
        try {
            return new AppendResult(
                    Long.parseLong(require(kv, "handle")),
                    Integer.parseInt(require(kv, "offset")),
                    Integer.parseInt(require(kv, "size")));
        } catch (RuntimeException e) {
            throw malformed(body, e);
        }
    }

    private static String require(Map<String, String> kv, String key) {
        String v = kv.get(key);
        if (v == null) throw new IllegalArgumentException("missing " + key);
        return v;
    }

    private static FsException malformed(String body, RuntimeException cause) {
        return new FsException(ErrorCode.UNREACHABLE, "malformed reply: " + cause.getMessage() + " body=" + body, cause);
    }
}
