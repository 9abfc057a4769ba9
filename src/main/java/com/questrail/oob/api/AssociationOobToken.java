package com.questrail.oob.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * AssociationOobToken
 * -----------------------------------------------------------------------------
 * Key material exchanged out of band during association.
 *
 * <p>Carries the session encryption key together with the initialization
 * vectors used by each side of the pairing (the head unit and the mobile
 * device). All three components are required and non-empty; how they are
 * used belongs to the pairing protocol above this channel.</p>
 */
public final class AssociationOobToken implements OobToken
{
    private final byte[] encryptionKey;
    private final byte[] ihuIv;
    private final byte[] mobileIv;

    public AssociationOobToken(byte[] encryptionKey, byte[] ihuIv, byte[] mobileIv)
    {
        this.encryptionKey = requireMaterial(encryptionKey, "encryptionKey");
        this.ihuIv = requireMaterial(ihuIv, "ihuIv");
        this.mobileIv = requireMaterial(mobileIv, "mobileIv");
    }

    public byte[] encryptionKey()
    {
        return encryptionKey.clone();
    }

    /** Initialization vector used by the head unit. */
    public byte[] ihuIv()
    {
        return ihuIv.clone();
    }

    /** Initialization vector used by the mobile device. */
    public byte[] mobileIv()
    {
        return mobileIv.clone();
    }

    private static byte[] requireMaterial(byte[] value, String name)
    {
        Objects.requireNonNull(value, name);
        if (value.length == 0) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        return value.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AssociationOobToken other)) {
            return false;
        }
        return Arrays.equals(encryptionKey, other.encryptionKey)
                && Arrays.equals(ihuIv, other.ihuIv)
                && Arrays.equals(mobileIv, other.mobileIv);
    }

    @Override
    public int hashCode()
    {
        int result = Arrays.hashCode(encryptionKey);
        result = 31 * result + Arrays.hashCode(ihuIv);
        result = 31 * result + Arrays.hashCode(mobileIv);
        return result;
    }

    @Override
    public String toString()
    {
        return "AssociationOobToken[keyLength=" + encryptionKey.length
                + ", ihuIvLength=" + ihuIv.length
                + ", mobileIvLength=" + mobileIv.length + "]";
    }
}
