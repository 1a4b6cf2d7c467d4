package com.github.anirbanmu.herald.util;

import java.net.http.HttpClient;
import java.time.Duration;

public final class Http {
    public static final HttpClient CLIENT = HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(2500))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();

    private Http() {
    }
}
