package com.csv2bufr.encoder.template;

import com.csv2bufr.model.FieldValue;
import com.csv2bufr.model.FloatValue;
import com.csv2bufr.model.IntegerValue;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes the byte layout of a packed {@link TemplateMessage}.
 *
 * <pre>
 * section 0  "BUFR" | total length (3 bytes) | edition (1 byte)
 * section 1  length (3) | master table (1) | template name
 * section 3  length (3) | replication count n (2) | n x factor (2)
 * section 4  length (3) | entry count (2) | entries
 * section 5  "7777"
 * </pre>
 * All numbers are big-endian. Each entry is the key (2-byte length + UTF-8) followed by its value(s);
 * every value is a one byte tag ({@code I}, {@code F}, {@code S}, {@code M}) and its payload.
 */
final class BufrSectionWriter {

    private static final byte[] START = "BUFR".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] END = "7777".getBytes(StandardCharsets.US_ASCII);

    private static final int MAX_LENGTH = 0xFFFFFF;
    private static final int MAX_COUNT = 0xFFFF;

    private BufrSectionWriter() {
    }

    static byte[] write(TemplateMessage message) throws IOException {
        MessageTemplate template = message.template();

        byte[] section1 = section(out -> {
            out.writeByte(template.getMasterTableNumber());
            writeString(out, template.getName());
        });
        byte[] section3 = section(out -> {
            List<Integer> counts = message.repetitionCounts();
            checkCount("replication factors", counts == null ? 0 : counts.size());
            out.writeShort(counts == null ? 0 : counts.size());
            if (counts != null) {
                for (Integer count : counts) {
                    out.writeShort(count);
                }
            }
        });
        byte[] section4 = section(out -> {
            checkCount("entries", message.entries().size());
            out.writeShort(message.entries().size());
            for (TemplateMessage.Entry entry : message.entries()) {
                writeString(out, entry.key);
                if (entry.array) {
                    out.writeByte('A');
                    checkCount("values for " + entry.key, entry.values.size());
                    out.writeShort(entry.values.size());
                }
                for (FieldValue value : entry.values) {
                    writeValue(out, value);
                }
            }
        });

        int total = START.length + 4 + section1.length + section3.length + section4.length + END.length;
        checkLength(total);

        ByteArrayOutputStream buffer = new ByteArrayOutputStream(total);
        DataOutputStream out = new DataOutputStream(buffer);
        out.write(START);
        write3(out, total);
        out.writeByte(template.getEdition());
        out.write(section1);
        out.write(section3);
        out.write(section4);
        out.write(END);
        out.flush();
        return buffer.toByteArray();
    }

    private static byte[] section(SectionBody body) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        DataOutputStream content = new DataOutputStream(buffer);
        body.writeTo(content);
        content.flush();
        byte[] bytes = buffer.toByteArray();

        int length = bytes.length + 3;
        checkLength(length);
        ByteArrayOutputStream section = new ByteArrayOutputStream(length);
        DataOutputStream out = new DataOutputStream(section);
        write3(out, length);
        out.write(bytes);
        out.flush();
        return section.toByteArray();
    }

    private static void writeValue(DataOutputStream out, FieldValue value) throws IOException {
        switch (value.getKind()) {
            case INTEGER -> {
                out.writeByte('I');
                out.writeLong(((IntegerValue) value).getValue());
            }
            case FLOAT -> {
                out.writeByte('F');
                out.writeDouble(((FloatValue) value).getValue());
            }
            case STRING -> {
                out.writeByte('S');
                writeString(out, value.asText());
            }
            case MISSING -> out.writeByte('M');
            default -> throw new IllegalArgumentException("cannot write nested " + value.getKind() + " value");
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        if (utf8.length > 0xFFFF) {
            throw new IOException("string too long for message: " + utf8.length + " bytes");
        }
        out.writeShort(utf8.length);
        out.write(utf8);
    }

    /**
     * Writes a three byte big-endian length.
     */
    static void write3(DataOutputStream out, int number) throws IOException {
        out.writeByte(number >> 16);
        out.writeByte(number >> 8);
        out.writeByte(number);
    }

    private static void checkCount(String what, int count) throws IOException {
        if (count > MAX_COUNT) {
            throw new IOException("too many " + what + ": " + count + " (at most " + MAX_COUNT + ")");
        }
    }

    private static void checkLength(int length) throws IOException {
        if (length > MAX_LENGTH) {
            throw new IOException("message section exceeds " + MAX_LENGTH + " bytes");
        }
    }

    @FunctionalInterface
    private interface SectionBody {
        void writeTo(DataOutputStream out) throws IOException;
    }
}
