package org.speeches.reader;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.Reader;

@Slf4j
public class HttpSourceOpener implements SourceOpener {

    private final OkHttpClient httpClient;

    public HttpSourceOpener(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Reader open(String source) throws IOException {
        HttpUrl url = source == null ? null : HttpUrl.parse(source.trim());
        if (url == null) {
            throw new SourceUnavailableException("Not an http(s) URL: '" + source + "'");
        }

        Request request = new Request.Builder()
                .url(url)
                .get()
                .build();
        Response response = httpClient.newCall(request).execute();

        if (!response.isSuccessful()) {
            int code = response.code();
            response.close();
            throw new SourceUnavailableException("HTTP status " + code + " for " + url);
        }
        ResponseBody body = response.body();
        if (body == null) {
            response.close();
            throw new SourceUnavailableException("Empty response body for " + url);
        }
        log.debug("Opened {} ({})", url, body.contentType());
        return body.charStream();
    }
}
