package xyz.vvrf.reactor.flow.client.http;

import lombok.Getter;

/**
 * 非 2xx 响应。
 */
@Getter
public class HttpCallException extends RuntimeException {

    private final int status;
    private final String detail;

    public HttpCallException(int status, String detail) {
        super(String.format("API Call Error (%d): %s", status, detail));
        this.status = status;
        this.detail = detail;
    }
}
