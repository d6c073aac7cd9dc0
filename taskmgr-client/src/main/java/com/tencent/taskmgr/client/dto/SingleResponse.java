package com.tencent.taskmgr.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 携带单个结果的响应，结果可能为空（如取任务时无可执行任务）
 *
 * @author taskmgr
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class SingleResponse<T> extends Response {

    private static final long serialVersionUID = -6120813370125932280L;

    private T data;

    public static <T> SingleResponse<T> of(T data) {
        SingleResponse<T> response = new SingleResponse<>();
        response.setData(data);
        return response;
    }

    public static <T> SingleResponse<T> empty() {
        return new SingleResponse<>();
    }

    public static <T> SingleResponse<T> buildFailureWith(String errCode, String errMessage) {
        SingleResponse<T> response = new SingleResponse<>();
        response.fail(errCode, errMessage);
        return response;
    }
}
