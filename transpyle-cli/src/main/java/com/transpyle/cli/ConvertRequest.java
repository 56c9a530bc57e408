package com.transpyle.cli;

/**
 * convert 请求体：{"code": "...", "toLang": "c|cpp|java"}
 */
public class ConvertRequest {

    private String code;
    private String toLang;

    public ConvertRequest() {
    }

    public ConvertRequest(String code, String toLang) {
        this.code = code;
        this.toLang = toLang;
    }

    /**
     * 缺省视为空程序
     */
    public String getCode() {
        return code != null ? code : "";
    }

    public String getToLang() {
        return toLang;
    }
}
