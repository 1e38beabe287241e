package com.questrail.consensus.signing;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Deterministic binary encoding of a payload, used as the input to hashing
 * and signing. Equal payloads must always produce equal bytes.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface ContentSerializer<T>
{
    void write(T value, DataOutputStream out) throws IOException;

    default byte[] serialize(T value)
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            write(value, out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw; anything here is a serializer defect.
            throw new SigningException("could not serialize " + value, e);
        }
        return bytes.toByteArray();
    }
}
