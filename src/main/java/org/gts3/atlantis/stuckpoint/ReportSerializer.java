package org.gts3.atlantis.stuckpoint;

import java.io.IOException;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.gts3.atlantis.stuckpoint.utils.FileUtils;

import static org.gts3.atlantis.stuckpoint.utils.LogLabel.LOG_ERROR;

/**
 * Serializes an {@link AnalysisReport} to pretty-printed JSON. Null fields are omitted.
 */
public class ReportSerializer {
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static String toJson(AnalysisReport report) {
        return gson.toJson(report);
    }

    /**
     * Writes the report atomically, replacing any previous file at {@code path}.
     *
     * @return The JSON that was written
     * @throws IOException If the file cannot be written
     */
    public static String write(Path path, AnalysisReport report) throws IOException {
        String json = toJson(report);
        try {
            FileUtils.writeStringAtomically(path, json);
        } catch (IOException e) {
            System.err.println(LOG_ERROR + "Error writing JSON file " + path + ": " + e.getMessage());
            throw e;
        }
        return json;
    }
}
