package io.polarion.http;

import java.io.InputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

public interface Transport {
    HttpResponse<InputStream> send(HttpRequest request);
}
