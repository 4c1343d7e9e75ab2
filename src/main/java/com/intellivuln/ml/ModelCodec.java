package com.intellivuln.ml;

import com.intellivuln.errors.ModelDataException;
import smile.classification.GradientTreeBoost;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

/**
 * Сериализация обученной модели Smile в непрозрачный payload
 */
final class ModelCodec {

    private ModelCodec() {
    }

    static byte[] encode(GradientTreeBoost model) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(model);
        }
        return bytes.toByteArray();
    }

    static GradientTreeBoost decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new ModelDataException("Пустой payload модели");
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(payload))) {
            Object value = in.readObject();
            if (!(value instanceof GradientTreeBoost model)) {
                throw new ModelDataException("Payload не содержит модель GradientTreeBoost: "
                    + (value != null ? value.getClass().getName() : "null"));
            }
            return model;
        } catch (IOException | ClassNotFoundException e) {
            throw new ModelDataException("Не удалось прочитать payload модели: " + e.getMessage(), e);
        }
    }
}
