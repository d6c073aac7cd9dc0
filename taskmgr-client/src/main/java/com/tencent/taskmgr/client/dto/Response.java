package com.tencent.taskmgr.client.dto;

import lombok.Data;

import java.io.Serializable;

/**
 * Response - 接口响应基类
 * <p>
 * 失败时 errCode 为错误码名称，如 TASK_NOT_FOUND、UPDATE_CONFLICT。
 * </p>
 *
 * @author taskmgr
 */
@Data
public class Response implements Serializable {

    private static final long serialVersionUID = 3151729836512207645L;

    private boolean success = true;

    private String errCode;

    private String errMessage;

    public static Response buildSuccess() {
        return new Response();
    }

    public static Response buildFailure(String errCode, String errMessage) {
        Response response = new Response();
        response.fail(errCode, errMessage);
        return response;
    }

    protected void fail(String errCode, String errMessage) {
        this.success = false;
        this.errCode = errCode;
        this.errMessage = errMessage;
    }
}
