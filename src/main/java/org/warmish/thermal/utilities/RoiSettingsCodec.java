package org.warmish.thermal.utilities;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.Point2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of the ROI list and of the detailed ROI report.
 *
 * <p>The ROI list round-trips through {@link #toJson(List)} and {@link #fromJson(String)};
 * polygon vertices are written as {@code [x, y]} pairs. Entries that are not JSON objects or
 * do not bind to a {@link RoiRecord} are logged and skipped rather than failing the whole
 * list.</p>
 */
public class RoiSettingsCodec {
    private static final Logger logger = LoggerFactory.getLogger(RoiSettingsCodec.class);

    private final Gson gson;
    private final Gson reportGson;

    public RoiSettingsCodec() {
        this.gson = new GsonBuilder()
                .registerTypeHierarchyAdapter(Point2D.class, new PointAdapter())
                .setPrettyPrinting()
                .create();
        this.reportGson = new GsonBuilder()
                .serializeNulls()
                .setPrettyPrinting()
                .create();
    }

    public String toJson(List<RoiRecord> records) {
        return gson.toJson(records);
    }

    /**
     * @throws IOException if the text is not a JSON array
     */
    public List<RoiRecord> fromJson(String json) throws IOException {
        JsonElement root;
        try {
            root = JsonParser.parseString(json == null ? "" : json);
        } catch (JsonParseException e) {
            throw new IOException("Malformed ROI list", e);
        }
        if (root == null || root.isJsonNull()) {
            return new ArrayList<>();
        }
        if (!root.isJsonArray()) {
            throw new IOException("ROI list must be a JSON array, got " + root.getClass().getSimpleName());
        }

        JsonArray array = root.getAsJsonArray();
        List<RoiRecord> records = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonElement element = array.get(i);
            if (!element.isJsonObject()) {
                logger.warn("Skipping ROI entry {}: not an object ({})", i, element);
                continue;
            }
            try {
                records.add(gson.fromJson(element, RoiRecord.class));
            } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
                logger.warn("Skipping ROI entry {}: {}", i, e.getMessage());
            }
        }
        logger.debug("Parsed {} of {} ROI entries", records.size(), array.size());
        return records;
    }

    public String toReportJson(List<RoiReport> reports) {
        return reportGson.toJson(reports);
    }

    /**
     * Writes points as {@code [x, y]}; reads either that form or {@code {"x":..,"y":..}}.
     */
    private static class PointAdapter extends TypeAdapter<Point2D> {

        @Override
        public void write(JsonWriter out, Point2D point) throws IOException {
            if (point == null) {
                out.nullValue();
                return;
            }
            out.beginArray();
            out.value(point.getX());
            out.value(point.getY());
            out.endArray();
        }

        @Override
        public Point2D read(JsonReader in) throws IOException {
            JsonToken token = in.peek();
            if (token == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            double x = 0;
            double y = 0;
            if (token == JsonToken.BEGIN_ARRAY) {
                in.beginArray();
                x = in.nextDouble();
                y = in.nextDouble();
                while (in.hasNext()) {
                    in.skipValue();
                }
                in.endArray();
            } else {
                in.beginObject();
                while (in.hasNext()) {
                    switch (in.nextName()) {
                        case "x" -> x = in.nextDouble();
                        case "y" -> y = in.nextDouble();
                        default -> in.skipValue();
                    }
                }
                in.endObject();
            }
            return new Point2D.Double(x, y);
        }
    }
}
