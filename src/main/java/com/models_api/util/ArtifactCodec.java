package com.models_api.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Envelope written around a plugin's serialized state:
 * magic {@code MDLS}, format version, model type (modified UTF-8), payload length, payload.
 * The type tag makes every artifact self-describing, so a file found on disk can be loaded
 * without any sidecar.
 */
public final class ArtifactCodec {

    static final int MAGIC = 0x4D444C53;
    static final int VERSION = 1;

    private ArtifactCodec() {
    }

    public record Artifact(String type, byte[] payload) {}

    public static byte[] encode(String type, byte[] payload) {
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream(payload.length + type.length() + 16);
             DataOutputStream out = new DataOutputStream(bos)) {
            out.writeInt(MAGIC);
            out.writeShort(VERSION);
            out.writeUTF(type);
            out.writeInt(payload.length);
            out.write(payload);
            out.flush();
            return bos.toByteArray();
        } catch (IOException e) {
            // ByteArrayOutputStream does not fail
            throw new IllegalStateException(e);
        }
    }

    public static Artifact decode(byte[] bytes) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes))) {
            String type = readHeader(in);
            int length = in.readInt();
            if (length < 0 || length > bytes.length) {
                throw new IOException("Corrupt artifact: payload length " + length);
            }
            byte[] payload = new byte[length];
            in.readFully(payload);
            return new Artifact(type, payload);
        } catch (EOFException e) {
            throw new IOException("Corrupt artifact: truncated", e);
        }
    }

    /**
     * Reads only the header of {@code file} and returns the model type.
     */
    public static String readType(Path file) throws IOException {
        try (InputStream is = Files.newInputStream(file);
             DataInputStream in = new DataInputStream(is)) {
            return readHeader(in);
        } catch (EOFException e) {
            throw new IOException("Corrupt artifact: truncated header", e);
        }
    }

    private static String readHeader(DataInputStream in) throws IOException {
        int magic = in.readInt();
        if (magic != MAGIC) {
            throw new IOException("Not a model artifact");
        }
        int version = in.readUnsignedShort();
        if (version != VERSION) {
            throw new IOException("Unsupported artifact version " + version);
        }
        return in.readUTF();
    }
}
