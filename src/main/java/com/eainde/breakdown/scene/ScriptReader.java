package com.eainde.breakdown.scene;

import com.eainde.breakdown.exception.BreakdownException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a screenplay file as UTF-8 in one go, before any pipeline work starts.
 */
@Component
public class ScriptReader {

    private static final Logger log = LoggerFactory.getLogger(ScriptReader.class);
    private static final char BOM = '\uFEFF';

    public String read(Path path) {
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            if (!text.isEmpty() && text.charAt(0) == BOM) {
                text = text.substring(1);
            }
            log.info("Read script {} ({} characters)", path.getFileName(), text.length());
            return text;
        } catch (IOException e) {
            throw new BreakdownException("Failed to read script " + path, e);
        }
    }
}
