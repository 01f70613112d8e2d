package uk.ac.ntu.chunkfs.master.liveness;

/**
 * Notified once per alive -> dead transition of a chunkserver. Called outside the master
 * lock, so it may call back into the master.
 */
@FunctionalInterface
public interface ReplicaLossListener {
    void onReplicaLoss(ReplicaLoss loss);
}
