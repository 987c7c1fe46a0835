package com.example.tscribe_backend.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Command-line bits shared by every yt-dlp invocation. */
public final class YtDlp {
    private static final Logger LOGGER = LoggerFactory.getLogger(YtDlp.class);

    private YtDlp() {}

    public static void appendCookies(List<String> cmd, String cookiesFile) {
        if (cookiesFile == null || cookiesFile.isBlank()) {
            return;
        }
        Path cookiesPath = Path.of(cookiesFile).toAbsolutePath();
        if (Files.exists(cookiesPath)) {
            cmd.add("--cookies");
            cmd.add(cookiesPath.toString());
        } else {
            LOGGER.warn("yt-dlp cookies file configured but missing path={}", cookiesPath);
        }
    }

    /**
     * yt-dlp prints its JSON dump as a single line; stderr is merged into the same stream, so pick
     * the last line that looks like a JSON object.
     */
    public static String lastJsonLine(String output) {
        if (output == null) {
            return null;
        }
        String[] lines = output.split("\\r?\\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].strip();
            if (line.startsWith("{") && line.endsWith("}")) {
                return line;
            }
        }
        return null;
    }
}
