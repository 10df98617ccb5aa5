package org.sensorvault.storage.file;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import org.sensorvault.storage.api.Reading;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

/**
 * JSON-lines encoding of readings in device file segments.
 * <p>
 * One reading per line, snake_case field names ({@code device_addr}, {@code temp_c}, ...) and
 * RFC 3339 timestamps in UTC with full nanosecond precision.
 */
public final class ReadingCodec {

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe())
            .serializeSpecialFloatingPointValues()
            .disableHtmlEscaping()
            .create();

    private ReadingCodec() {
    }

    /**
     * Encodes one reading as a single JSON line (without the line terminator).
     */
    public static String encode(Reading reading) {
        return GSON.toJson(reading);
    }

    /**
     * Decodes one JSON line.
     *
     * @param line JSON document
     * @return the reading
     * @throws JsonParseException if the line is not a valid reading
     */
    public static Reading decode(String line) {
        Reading reading;
        try {
            reading = GSON.fromJson(line, Reading.class);
        } catch (JsonParseException e) {
            throw e;
        } catch (RuntimeException e) {
            // record constructor rejected the values (e.g. missing device_addr)
            throw new JsonParseException("Invalid reading: " + e.getMessage(), e);
        }
        if (reading == null) {
            throw new JsonParseException("Empty reading document");
        }
        return reading;
    }

    /**
     * Reads every reading of an (already decompressed) segment stream.
     * <p>
     * A malformed line fails the whole segment so that callers can skip it as one unit.
     *
     * @param in segment content, UTF-8 JSON lines
     * @return the readings in file order
     * @throws IOException if the stream cannot be read or a line is malformed
     */
    public static List<Reading> readAll(InputStream in) throws IOException {
        List<Reading> readings = new ArrayList<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                readings.add(decode(line));
            } catch (JsonParseException e) {
                throw new IOException("Malformed reading at line " + lineNumber + ": " + e.getMessage(), e);
            }
        }
        return readings;
    }

    private static final class InstantAdapter extends TypeAdapter<Instant> {

        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(DateTimeFormatter.ISO_INSTANT.format(value));
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            if (in.peek() != JsonToken.STRING) {
                throw new JsonParseException("Expected RFC 3339 timestamp string at " + in.getPath());
            }
            String text = in.nextString();
            try {
                return DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(text, Instant::from);
            } catch (DateTimeParseException e) {
                throw new JsonParseException("Invalid timestamp '" + text + "'", e);
            }
        }
    }
}
