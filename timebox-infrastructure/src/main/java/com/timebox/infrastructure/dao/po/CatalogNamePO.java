package com.timebox.infrastructure.dao.po;

import lombok.Data;

/**
 * 项目/类别名称 PO。
 */
@Data
public class CatalogNamePO {

    private Long id;
    private String name;
}
