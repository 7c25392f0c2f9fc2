package org.databaseclone.clone.diff;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import org.databaseclone.clone.models.Document;
import org.databaseclone.clone.models.FieldValue;
import org.databaseclone.clone.models.FieldValues;
import org.databaseclone.clone.sanitize.DocumentSanitizer;

import lombok.Getter;

/** Keys of the documents already present in a destination collection. */
public class ExistingRecordSet {
    @Getter
    private final Optional<String> identifierField;
    private final DocumentSanitizer sanitizer;
    private final Set<RecordKey> keys = new HashSet<>();

    ExistingRecordSet(Optional<String> identifierField, DocumentSanitizer sanitizer) {
        this.identifierField = identifierField;
        this.sanitizer = sanitizer;
    }

    void add(Document document) {
        keys.add(keyOf(document));
    }

    public boolean contains(Document document) {
        return keys.contains(keyOf(document));
    }

    public int size() {
        return keys.size();
    }

    /**
     * The identifier field's value when one is configured and the document carries a non-null
     * value for it, otherwise the compact JSON of the sanitized document.  Identifier values keep
     * their JSON type, so the number {@code 1} never matches the string {@code "1"}, while numbers
     * compare by value and {@code 1} matches {@code 1.0}.
     */
    public RecordKey keyOf(Document document) {
        var identifier = identifierField.map(document::get).filter(v -> !v.isNull());
        if (identifier.isPresent()) {
            return RecordKey.identifier(identifierText(identifier.get()));
        }
        return RecordKey.content(FieldValues.toCompactJson(sanitizer.sanitize(document)));
    }

    private static String identifierText(FieldValue value) {
        if (value instanceof FieldValue.NumberValue) {
            var number = ((FieldValue.NumberValue) value).value();
            return number.signum() == 0 ? "0" : number.stripTrailingZeros().toPlainString();
        }
        return FieldValues.toCompactJson(value);
    }
}
