package com.transpyle.cli;

/**
 * convert 响应体：成功时只有 result，失败时只有 error
 */
public class ConvertResponse {

    private final String result;
    private final String error;

    private ConvertResponse(String result, String error) {
        this.result = result;
        this.error = error;
    }

    public static ConvertResponse result(String result) {
        return new ConvertResponse(result, null);
    }

    public static ConvertResponse error(String error) {
        return new ConvertResponse(null, error);
    }

    public String getResult() {
        return result;
    }

    public String getError() {
        return error;
    }
}
