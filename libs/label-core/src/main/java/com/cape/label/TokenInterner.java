package com.cape.label;

import com.cape.label.model.Token;
import com.cape.label.store.LabelStore;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps token values to stable ids, creating a token on first use only. */
public class TokenInterner {

    private static final Logger log = LoggerFactory.getLogger(TokenInterner.class);

    private final LabelStore store;

    public TokenInterner(LabelStore store) {
        this.store = store;
    }

    /**
     * Returns the id of the token with {@code value}, inserting it when absent.
     *
     * @throws IllegalArgumentException if the value is null, blank or longer than {@link
     *     Token#MAX_VALUE_LENGTH}
     */
    public long intern(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("token value must not be null or blank");
        }
        if (value.length() > Token.MAX_VALUE_LENGTH) {
            throw new IllegalArgumentException(
                    "token value exceeds " + Token.MAX_VALUE_LENGTH + " characters");
        }
        var existing = store.findTokenByValue(value);
        if (existing.isPresent()) {
            return existing.get().id();
        }
        var inserted = store.insertToken(value);
        if (inserted.isPresent()) {
            log.debug("Interned token '{}' as {}", value, inserted.get());
            return inserted.get();
        }
        // lost the insert race; the winner's row is visible now
        return store.findTokenByValue(value)
                .map(Token::id)
                .orElseThrow(() -> new IllegalStateException("token '" + value + "' vanished"));
    }

    /** Interns every value, preserving first-seen order and dropping repeats. */
    public Set<Long> internAll(Collection<String> values) {
        Set<Long> ids = new LinkedHashSet<>();
        for (String value : values) {
            ids.add(intern(value));
        }
        return ids;
    }
}
