package cable.util;

import java.util.Map;

/**
 * Converts message metadata ({@code Map<String, String>}) to and from the JSON text kept in
 * the {@code metadata} column.
 *
 * <p>{@link DefaultJsonCodec} handles flat string-to-string objects without any third-party
 * library. Applications that already ship Jackson or Gson can plug in their own implementation
 * through the store constructors and {@code SolidCable.Builder#jsonCodec}.
 */
public interface JsonCodec {

    /**
     * Returns the shared built-in codec.
     *
     * @return the default codec
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes metadata as a JSON object.
     *
     * @param metadata the metadata, may be {@code null}
     * @return JSON text, or {@code null} when the map is null or empty
     */
    String toJson(Map<String, String> metadata);

    /**
     * Decodes a JSON object into metadata.
     *
     * @param json JSON text, may be {@code null}
     * @return the decoded map, empty for {@code null}, blank or {@code "null"} input
     * @throws IllegalArgumentException if the text is not a flat JSON object of strings
     */
    Map<String, String> parseObject(String json);
}
