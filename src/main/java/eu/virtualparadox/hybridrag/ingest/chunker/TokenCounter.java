package eu.virtualparadox.hybridrag.ingest.chunker;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import org.springframework.stereotype.Component;

/**
 * Counts tokens with the {@code cl100k_base} byte-pair encoding.
 * <p>One instance is shared by every component that measures text, so chunk sizes computed at
 * indexing time and budgets checked at query time agree.</p>
 */
@Component
public class TokenCounter {

    private final Encoding encoding;

    public TokenCounter() {
        final EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        this.encoding = registry.getEncoding(EncodingType.CL100K_BASE);
    }

    public int count(final String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }
}
