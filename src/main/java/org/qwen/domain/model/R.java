package org.qwen.domain.model;

import lombok.Data;

/**
 * 统一响应包装
 */
@Data
public class R<T> {

    public static final int SUCCESS = 200;

    public static final int FAIL = 500;

    private int code;

    private String msg;

    private T data;

    public static <T> R<T> ok(T data) {
        return build(data, SUCCESS, "操作成功");
    }

    public static <T> R<T> fail(String msg) {
        return build(null, FAIL, msg);
    }

    public static <T> R<T> fail(int code, String msg) {
        return build(null, code, msg);
    }

    private static <T> R<T> build(T data, int code, String msg) {
        R<T> r = new R<>();
        r.setCode(code);
        r.setData(data);
        r.setMsg(msg);
        return r;
    }
}
