package com.wangbin.hostkeeper.core.module.model;

import java.util.List;
import java.util.Optional;

/**
 * 分页参数，位于命令参数末尾：page_number, page_size
 *
 * @param pageNumber 页码，从1开始，1 为最新一页
 * @param pageSize   每页行数
 */
public record Pagination(int pageNumber, int pageSize) {

    public static final int DEFAULT_PAGE_SIZE = 400;

    /**
     * 从参数列表的 offset 位置读取分页参数，缺失或非法时使用默认值
     */
    public static Pagination from(List<String> params, int offset) {
        int pageNumber = parse(params, offset, 1);
        int pageSize = parse(params, offset + 1, DEFAULT_PAGE_SIZE);
        return new Pagination(pageNumber, pageSize);
    }

    /**
     * 需要从末尾读取的总行数，超出 int 范围时取上限
     */
    public int tailLines() {
        return (int) Math.min((long) pageNumber * pageSize, Integer.MAX_VALUE);
    }

    /**
     * 校验分页范围
     *
     * @return 错误信息，合法时为空
     */
    public Optional<String> validate() {
        if ((long) pageNumber * pageSize > Integer.MAX_VALUE) {
            return Optional.of(String.format("分页超出范围: 第%d页, 每页%d行", pageNumber, pageSize));
        }
        return Optional.empty();
    }

    public boolean isFirstPage() {
        return pageNumber == 1;
    }

    private static int parse(List<String> params, int index, int defaultValue) {
        if (params == null || index >= params.size()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(params.get(index).trim());
            return value > 0 ? value : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
