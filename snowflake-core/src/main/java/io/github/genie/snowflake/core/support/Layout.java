package io.github.genie.snowflake.core.support;

import io.github.genie.snowflake.core.exception.InvalidBitLengthException;

/**
 * Bit widths of the four segments of an id. From the most significant end:
 * <pre>
 * | 0 | time | sequence | data center id | machine id |
 * </pre>
 * The widths always add up to 63, so the sign bit stays clear. A layout without a data center
 * segment has a data center width of 0.
 */
public final class Layout {

    public static final int TOTAL_BITS = 63;

    public static final int DEFAULT_TIME_BITS = 41;
    public static final int DEFAULT_SEQUENCE_BITS = 12;
    public static final int DEFAULT_DATA_CENTER_ID_BITS = 5;
    public static final int DEFAULT_MACHINE_ID_BITS = 5;

    public static final Layout DEFAULT = of(
            DEFAULT_TIME_BITS,
            DEFAULT_SEQUENCE_BITS,
            DEFAULT_DATA_CENTER_ID_BITS,
            DEFAULT_MACHINE_ID_BITS
    );

    public static final Layout DEFAULT_NO_DATA_CENTER = withoutDataCenter(
            DEFAULT_TIME_BITS,
            DEFAULT_SEQUENCE_BITS,
            DEFAULT_DATA_CENTER_ID_BITS + DEFAULT_MACHINE_ID_BITS
    );

    private final int timeBits;
    private final int sequenceBits;
    private final int dataCenterIdBits;
    private final int machineIdBits;

    private final int timeShift;
    private final int sequenceShift;
    private final int dataCenterIdShift;

    private final long timeMask;
    private final long sequenceMask;
    private final long dataCenterIdMask;
    private final long machineIdMask;

    private Layout(int timeBits, int sequenceBits, int dataCenterIdBits, int machineIdBits) {
        this.timeBits = timeBits;
        this.sequenceBits = sequenceBits;
        this.dataCenterIdBits = dataCenterIdBits;
        this.machineIdBits = machineIdBits;

        this.dataCenterIdShift = machineIdBits;
        this.sequenceShift = dataCenterIdBits + machineIdBits;
        this.timeShift = sequenceBits + dataCenterIdBits + machineIdBits;

        this.timeMask = mask(timeBits);
        this.sequenceMask = mask(sequenceBits);
        this.dataCenterIdMask = mask(dataCenterIdBits);
        this.machineIdMask = mask(machineIdBits);
    }

    public static Layout of(int timeBits, int sequenceBits, int dataCenterIdBits, int machineIdBits) {
        if (timeBits < 0 || sequenceBits < 0 || dataCenterIdBits < 0 || machineIdBits < 0
            || timeBits + sequenceBits + dataCenterIdBits + machineIdBits != TOTAL_BITS) {
            throw new InvalidBitLengthException(timeBits, sequenceBits, dataCenterIdBits, machineIdBits);
        }
        return new Layout(timeBits, sequenceBits, dataCenterIdBits, machineIdBits);
    }

    public static Layout withoutDataCenter(int timeBits, int sequenceBits, int machineIdBits) {
        return of(timeBits, sequenceBits, 0, machineIdBits);
    }

    private static long mask(int bits) {
        return ~(-1L << bits);
    }

    public long pack(long time, long sequence, long dataCenterId, long machineId) {
        return time << timeShift
               | sequence << sequenceShift
               | dataCenterId << dataCenterIdShift
               | machineId;
    }

    public DecomposedId decompose(long id) {
        return DecomposedId.decompose(id, this);
    }

    public boolean hasDataCenter() {
        return dataCenterIdBits > 0;
    }

    public int getTimeBits() {
        return timeBits;
    }

    public int getSequenceBits() {
        return sequenceBits;
    }

    public int getDataCenterIdBits() {
        return dataCenterIdBits;
    }

    public int getMachineIdBits() {
        return machineIdBits;
    }

    public int getTimeShift() {
        return timeShift;
    }

    public int getSequenceShift() {
        return sequenceShift;
    }

    public int getDataCenterIdShift() {
        return dataCenterIdShift;
    }

    public long getMaxTime() {
        return timeMask;
    }

    public long getMaxSequence() {
        return sequenceMask;
    }

    public long getMaxDataCenterId() {
        return dataCenterIdMask;
    }

    public long getMaxMachineId() {
        return machineIdMask;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Layout)) {
            return false;
        }
        Layout that = (Layout) o;
        return timeBits == that.timeBits
               && sequenceBits == that.sequenceBits
               && dataCenterIdBits == that.dataCenterIdBits
               && machineIdBits == that.machineIdBits;
    }

    @Override
    public int hashCode() {
        return ((timeBits * 64 + sequenceBits) * 64 + dataCenterIdBits) * 64 + machineIdBits;
    }

    @Override
    public String toString() {
        return "Layout{time=" + timeBits
               + ", sequence=" + sequenceBits
               + ", dataCenterId=" + dataCenterIdBits
               + ", machineId=" + machineIdBits + '}';
    }

}
