package com.community.tracker.client;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 外部目录服务返回的账号资料
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExternalProfile {

    private Long profileId;

    // 外部目录中账号名的标准写法
    private String handle;

    private String avatarUrl;

    private String siteUrl;
}
