package anyrun.core.model.request;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of an outbound request.
 */
public sealed interface RequestBody {

    record None() implements RequestBody {}

    record Json(String json) implements RequestBody {
        public Json {
            if (json == null) {
                throw new IllegalArgumentException("json is required");
            }
        }
    }

    /**
     * URL-encoded form fields, in insertion order.
     */
    record Form(Map<String, String> fields) implements RequestBody {
        public Form {
            fields = fields == null ? Map.of() : new LinkedHashMap<>(fields);
        }
    }

    /**
     * Multipart form with a single binary part.
     */
    record Multipart(Map<String, String> fields, FilePart file) implements RequestBody {
        public Multipart {
            fields = fields == null ? Map.of() : new LinkedHashMap<>(fields);
            if (file == null) {
                throw new IllegalArgumentException("file part is required");
            }
        }
    }

    /**
     * Binary upload inside a multipart body.
     *
     * @param fieldName form field name, {@code file} for submissions
     * @param filename  file name reported to the service
     * @param content   raw bytes
     * @param mediaType content type of the part
     */
    record FilePart(String fieldName, String filename, byte[] content, String mediaType) {
        public FilePart {
            if (content == null) {
                content = new byte[0];
            }
            if (mediaType == null) {
                mediaType = "application/octet-stream";
            }
        }
    }

    static RequestBody none() {
        return new None();
    }
}
