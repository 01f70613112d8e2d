package uk.ac.ntu.chunkfs.chunkserver;

@FunctionalInterface
public interface ForwardingFailureListener {
    void onForwardingFailure(ForwardingFailure failure);
}
