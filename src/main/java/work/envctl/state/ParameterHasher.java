package work.envctl.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import work.envctl.params.ResolvedParameters;
import work.envctl.template.ParameterDefinition;
import work.envctl.template.ParameterValue;
import work.envctl.template.Template;

/**
 * SHA-256 over the canonical JSON of the effective parameter values (resolved value, else declared default),
 * sorted by name. Definition metadata never contributes.
 */
public final class ParameterHasher {
    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private ParameterHasher() {}

    public static String hash(Template template, ResolvedParameters parameters) {
        Map<String, Object> effective = new TreeMap<>();
        for (ParameterDefinition definition : template.parameters().values()) {
            ParameterValue value = parameters.get(definition.name()).orElse(definition.defaultValue().orElse(null));
            if (value != null) {
                effective.put(definition.name(), value.toPlain());
            }
        }
        try {
            byte[] canonical = CANONICAL.writeValueAsBytes(effective);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize parameters for hashing", ex);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

}
