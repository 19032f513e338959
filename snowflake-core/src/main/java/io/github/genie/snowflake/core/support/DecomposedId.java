package io.github.genie.snowflake.core.support;

import java.time.Duration;

/**
 * The segments of an id, recovered with the layout the id was generated with.
 */
public final class DecomposedId {

    private final long id;
    private final long time;
    private final long sequence;
    private final long dataCenterId;
    private final long machineId;

    public DecomposedId(long id, long time, long sequence, long dataCenterId, long machineId) {
        this.id = id;
        this.time = time;
        this.sequence = sequence;
        this.dataCenterId = dataCenterId;
        this.machineId = machineId;
    }

    public static DecomposedId decompose(long id, Layout layout) {
        return new DecomposedId(
                id,
                id >>> layout.getTimeShift() & layout.getMaxTime(),
                id >>> layout.getSequenceShift() & layout.getMaxSequence(),
                id >>> layout.getDataCenterIdShift() & layout.getMaxDataCenterId(),
                id & layout.getMaxMachineId()
        );
    }

    public static DecomposedId decompose(long id, int timeBits, int sequenceBits, int dataCenterIdBits, int machineIdBits) {
        return decompose(id, Layout.of(timeBits, sequenceBits, dataCenterIdBits, machineIdBits));
    }

    public long getId() {
        return id;
    }

    /**
     * @return ticks elapsed since the generator's start time
     */
    public long getTime() {
        return time;
    }

    public long getSequence() {
        return sequence;
    }

    public long getDataCenterId() {
        return dataCenterId;
    }

    public long getMachineId() {
        return machineId;
    }

    public long nanosTime(Duration tickUnit) {
        return Math.multiplyExact(time, tickUnit.toNanos());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DecomposedId)) {
            return false;
        }
        DecomposedId that = (DecomposedId) o;
        return id == that.id
               && time == that.time
               && sequence == that.sequence
               && dataCenterId == that.dataCenterId
               && machineId == that.machineId;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "DecomposedId{id=" + id
               + ", time=" + time
               + ", sequence=" + sequence
               + ", dataCenterId=" + dataCenterId
               + ", machineId=" + machineId + '}';
    }

}
