package com.github.anirbanmu.herald.util;

import java.util.List;

// immutable copies for decoded record components
public final class Lists {
    private Lists() {
    }

    // absent array on the wire reads as empty
    public static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    // absent array on the wire stays absent
    public static <T> List<T> copyOrNull(List<T> list) {
        return list == null ? null : List.copyOf(list);
    }
}
