package com.retail.loyalty_backend.common.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 分页结果，page 从 1 开始。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageVo<T> {
    private Long total;
    private Integer page;
    private Integer size;
    private Integer totalPages;
    private List<T> list;

    public static <T> PageVo<T> of(long total, int page, int size, List<T> list) {
        int totalPages = size <= 0 ? 0 : (int) ((total + size - 1) / size);
        return new PageVo<>(total, page, size, totalPages, list);
    }
}
