package com.synos.anomaly.ml;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.io.UncheckedIOException;

/**
 * scorer/scaler <-> byte[] (ml_models 테이블 BLOB 컬럼)
 */
public final class ModelSerializer {

    private ModelSerializer() {
    }

    public static byte[] serialize(Serializable object) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(buffer)) {
            out.writeObject(object);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize " + object.getClass().getSimpleName(), e);
        }
        return buffer.toByteArray();
    }

    public static <T> T deserialize(byte[] data, Class<T> type) {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data))) {
            Object object = in.readObject();
            return type.cast(object);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize " + type.getSimpleName(), e);
        } catch (ClassNotFoundException | ClassCastException e) {
            throw new IllegalStateException("Stored model is not a " + type.getSimpleName(), e);
        }
    }
}
