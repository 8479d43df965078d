package com.myorg.olc.ledger.store;

import com.myorg.olc.contracts.core.exception.ValidationException;
import lombok.experimental.UtilityClass;

@UtilityClass
public class LedgerKeys {

    public static final char SEPARATOR = '#';

    public static String key(String namespace, String id) {
        requireNamespace(namespace);
        if (id == null || id.isBlank()) {
            throw new ValidationException("id is required for namespace " + namespace);
        }
        return namespace + SEPARATOR + id;
    }

    public static boolean inNamespace(String namespace, String partitionKey) {
        return partitionKey != null && partitionKey.startsWith(namespace + SEPARATOR);
    }

    /** Conditional writes may only touch keys that carry the namespace token. */
    public static void requireInNamespace(String namespace, String partitionKey) {
        requireNamespace(namespace);
        if (!inNamespace(namespace, partitionKey)) {
            throw new ValidationException(
                    "partitionKey '" + partitionKey + "' is outside namespace '" + namespace + "'");
        }
    }

    // <len(pk)>:<pk>:<sk>; the length makes the split unambiguous whatever the keys contain
    static String entryKey(String partitionKey, String sortKey) {
        return partitionKey.length() + ":" + partitionKey + ":" + sortKey;
    }

    // sortKey + NUL + partitionKey: index order is by sort key, ties broken by partition
    static String indexMember(LedgerEntry e) {
        return e.sortKey() + '\u0000' + e.partitionKey();
    }

    static String[] splitIndexMember(String member) {
        int i = member.indexOf('\u0000');
        return new String[]{member.substring(0, i), member.substring(i + 1)};
    }

    private static void requireNamespace(String namespace) {
        if (namespace == null || namespace.isBlank() || namespace.indexOf(SEPARATOR) >= 0) {
            throw new ValidationException("invalid namespace '" + namespace + "'");
        }
    }
}
