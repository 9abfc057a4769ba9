package com.questrail.oob.codec.token;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import com.questrail.oob.api.AssociationOobToken;
import com.questrail.oob.api.OobToken;

import java.io.IOException;
import java.util.Objects;

/**
 * AssociationTokenCodec
 * -----------------------------------------------------------------------------
 * {@link OobTokenCodec} for {@link OobWireFormat#STRUCTURED} payloads.
 *
 * <p>The payload is a protocol-buffers encoding of the association envelope
 * shared with the peer:</p>
 *
 * <pre>
 *   message OutOfBandAssociationToken {
 *     bytes encryption_key = 1;
 *     bytes ihu_iv = 2;
 *     bytes mobile_iv = 3;
 *   }
 * </pre>
 *
 * <p>The envelope is read and written field by field with
 * {@link CodedInputStream}/{@link CodedOutputStream}. Unknown fields are
 * skipped; a repeated field keeps its last value. All three fields must be
 * present and non-empty.</p>
 */
public final class AssociationTokenCodec implements OobTokenCodec
{
    static final int ENCRYPTION_KEY_FIELD = 1;
    static final int IHU_IV_FIELD = 2;
    static final int MOBILE_IV_FIELD = 3;

    private static final int ENCRYPTION_KEY_TAG = bytesTag(ENCRYPTION_KEY_FIELD);
    private static final int IHU_IV_TAG = bytesTag(IHU_IV_FIELD);
    private static final int MOBILE_IV_TAG = bytesTag(MOBILE_IV_FIELD);

    @Override
    public AssociationOobToken decode(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        ByteString encryptionKey = ByteString.EMPTY;
        ByteString ihuIv = ByteString.EMPTY;
        ByteString mobileIv = ByteString.EMPTY;

        CodedInputStream input = CodedInputStream.newInstance(payload);
        try {
            boolean done = false;
            while (!done) {
                int tag = input.readTag();
                if (tag == 0) {
                    done = true;
                } else if (tag == ENCRYPTION_KEY_TAG) {
                    encryptionKey = input.readBytes();
                } else if (tag == IHU_IV_TAG) {
                    ihuIv = input.readBytes();
                } else if (tag == MOBILE_IV_TAG) {
                    mobileIv = input.readBytes();
                } else if (!input.skipField(tag)) {
                    // END_GROUP tag at top level
                    throw new OobTokenDecodeException("Unexpected end-group tag in association envelope");
                }
            }
        } catch (InvalidProtocolBufferException e) {
            throw new OobTokenDecodeException("Association envelope does not parse", e);
        } catch (IOException e) {
            // CodedInputStream over a byte array only raises the subclass above.
            throw new OobTokenDecodeException("Association envelope could not be read", e);
        }

        requirePresent(encryptionKey, "encryption_key");
        requirePresent(ihuIv, "ihu_iv");
        requirePresent(mobileIv, "mobile_iv");

        return new AssociationOobToken(
                encryptionKey.toByteArray(),
                ihuIv.toByteArray(),
                mobileIv.toByteArray());
    }

    @Override
    public byte[] encode(OobToken token)
    {
        Objects.requireNonNull(token, "token");
        if (!(token instanceof AssociationOobToken association)) {
            throw new IllegalArgumentException("Structured wire format cannot carry " + token);
        }

        byte[] encryptionKey = association.encryptionKey();
        byte[] ihuIv = association.ihuIv();
        byte[] mobileIv = association.mobileIv();

        int size = CodedOutputStream.computeByteArraySize(ENCRYPTION_KEY_FIELD, encryptionKey)
                + CodedOutputStream.computeByteArraySize(IHU_IV_FIELD, ihuIv)
                + CodedOutputStream.computeByteArraySize(MOBILE_IV_FIELD, mobileIv);

        byte[] out = new byte[size];
        CodedOutputStream output = CodedOutputStream.newInstance(out);
        try {
            output.writeByteArray(ENCRYPTION_KEY_FIELD, encryptionKey);
            output.writeByteArray(IHU_IV_FIELD, ihuIv);
            output.writeByteArray(MOBILE_IV_FIELD, mobileIv);
            output.checkNoSpaceLeft();
        } catch (IOException e) {
            throw new IllegalStateException("Association envelope size miscomputed", e);
        }
        return out;
    }

    private static void requirePresent(ByteString value, String field)
    {
        if (value.isEmpty()) {
            throw new OobTokenDecodeException("Association envelope is missing " + field);
        }
    }

    private static int bytesTag(int fieldNumber)
    {
        return (fieldNumber << 3) | WireFormat.WIRETYPE_LENGTH_DELIMITED;
    }
}
