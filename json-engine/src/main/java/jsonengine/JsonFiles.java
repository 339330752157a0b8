package jsonengine;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Reads JSON documents from the file system.
 *
 * <p> Problems obtaining the text surface as {@link JsonException.ReadException}, problems with the text itself
 * as {@link JsonException.SyntaxException}.
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class JsonFiles {

    private static final Logger LOG = Logger.getLogger(JsonFiles.class.getName());

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private JsonFiles() {
        throw new UnsupportedOperationException();
    }

    /**
     * Read a file as strict UTF-8 text.
     *
     * @param path file to read, not {@code null}
     * @return the decoded text, or a {@link JsonException.ReadException} failure
     */
    public static JsonResult<String> load(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            LOG.fine(() -> "Failed to read " + path + ": " + e);
            return JsonResult.failure(new JsonException.ReadException("Cannot read file", path.toString(), e));
        }
        LOG.fine(() -> "Read " + bytes.length + " bytes from " + path);

        int offset = hasBom(bytes) ? UTF8_BOM.length : 0;
        try {
            var decoder = StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            return JsonResult.success(
                    decoder.decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset))
                            .toString());
        } catch (CharacterCodingException e) {
            LOG.fine(() -> "Invalid UTF-8 in " + path + ": " + e);
            return JsonResult.failure(
                    new JsonException.ReadException("File is not valid UTF-8", path.toString(), e));
        }
    }

    /**
     * Read a file named by a path string.
     *
     * @param path file path, not {@code null}
     * @return the decoded text, or a {@link JsonException.ReadException} failure (also for malformed paths)
     */
    public static JsonResult<String> load(String path) {
        Path p;
        try {
            p = Path.of(path);
        } catch (InvalidPathException e) {
            return JsonResult.failure(new JsonException.ReadException("Invalid path", path, e));
        }
        return load(p);
    }

    /**
     * Read and parse a file.
     *
     * @param path   file to read, not {@code null}
     * @param parser parser to hand the decoded text to
     * @return the parsed tree, or the read or syntax failure
     */
    public static JsonResult<JsonValue> read(Path path, Json.Parser parser) {
        return load(path).flatMap(parser::read);
    }

    private static boolean hasBom(byte[] bytes) {
        return bytes.length >= 3 && bytes[0] == UTF8_BOM[0] && bytes[1] == UTF8_BOM[1] && bytes[2] == UTF8_BOM[2];
    }
}
