package com.sailfish.retrydispatch.worker;

/**
 * One external call made for one record: the raw request and response are kept for the audit log.
 */
public final class CalloutExchange {

    private final String request;
    private final String response;
    private final Integer statusCode;
    private final boolean success;
    private final String error;

    private CalloutExchange(String request, String response, Integer statusCode, boolean success, String error) {
        this.request = request;
        this.response = response;
        this.statusCode = statusCode;
        this.success = success;
        this.error = error;
    }

    public static CalloutExchange success(String request, String response, Integer statusCode) {
        return new CalloutExchange(request, response, statusCode, true, null);
    }

    public static CalloutExchange failure(String request, String response, Integer statusCode, String error) {
        return new CalloutExchange(request, response, statusCode, false,
                error != null ? error : "Callout failed with status " + statusCode);
    }

    public String getRequest() { return request; }
    public String getResponse() { return response; }
    public Integer getStatusCode() { return statusCode; }
    public boolean isSuccess() { return success; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return "CalloutExchange{statusCode=" + statusCode + ", success=" + success + ", error='" + error + "'}";
    }
}
