package org.Aayush.panref.core;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * Re-openable source of configuration lines.
 *
 * <p>Each stage opens its own reader and closes it before the next stage starts.</p>
 */
public interface LineSource {

    /**
     * Opens a fresh reader positioned at the first line.
     *
     * @throws java.nio.file.NoSuchFileException when the underlying input does not exist.
     * @throws IOException when the input cannot be opened.
     */
    BufferedReader open() throws IOException;

    /**
     * Short description used in log and outcome messages.
     */
    String describe();
}
