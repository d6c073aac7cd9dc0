package com.tencent.taskmgr.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 携带列表结果的响应
 *
 * @author taskmgr
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class MultiResponse<T> extends Response {

    private static final long serialVersionUID = 8820455319204787731L;

    private List<T> data = new ArrayList<>();

    public int getTotal() {
        return data == null ? 0 : data.size();
    }

    public static <T> MultiResponse<T> of(Collection<T> data) {
        MultiResponse<T> response = new MultiResponse<>();
        response.setData(new ArrayList<>(data));
        return response;
    }
}
