package com.couponbot.pipeline.domain.fetch;

public record FetchedPage(String url, int status, String body) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean contains(String text) {
        return body != null && text != null && body.contains(text);
    }
}
