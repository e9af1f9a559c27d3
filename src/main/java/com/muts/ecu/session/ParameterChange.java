package com.muts.ecu.session;

import java.util.Arrays;
import java.util.Objects;

/**
 * One map or parameter delta of a changeset.
 *
 * @param name          calibration name (for audit and UI)
 * @param address       ECU address of the value
 * @param previousValue bytes currently in the ECU; written back on revert
 * @param newValue      bytes to write
 */
public record ParameterChange(String name, long address, byte[] previousValue, byte[] newValue)
{
    public ParameterChange {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(previousValue, "previousValue");
        Objects.requireNonNull(newValue, "newValue");
        if (address < 0) {
            throw new IllegalArgumentException("address must be >= 0");
        }
        if (newValue.length == 0) {
            throw new IllegalArgumentException("newValue must not be empty");
        }
        previousValue = previousValue.clone();
        newValue = newValue.clone();
    }

    @Override
    public byte[] previousValue()
    {
        return previousValue.clone();
    }

    @Override
    public byte[] newValue()
    {
        return newValue.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParameterChange other)) {
            return false;
        }
        return address == other.address
            && name.equals(other.name)
            && Arrays.equals(previousValue, other.previousValue)
            && Arrays.equals(newValue, other.newValue);
    }

    @Override
    public int hashCode()
    {
        int h = Objects.hash(name, address);
        h = 31 * h + Arrays.hashCode(previousValue);
        return 31 * h + Arrays.hashCode(newValue);
    }

    @Override
    public String toString()
    {
        return "ParameterChange[" + name + "@0x" + Long.toHexString(address) + ", " + newValue.length + " bytes]";
    }
}
