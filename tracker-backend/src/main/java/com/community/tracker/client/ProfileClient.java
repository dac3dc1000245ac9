package com.community.tracker.client;

import java.util.Optional;

/**
 * 外部动画/漫画目录服务接口。实现类以 UPSTREAM_UNAVAILABLE 类型的
 * {@link com.community.tracker.exception.TrackerException} 报告失败，
 * 不做重试，重试策略由调用方决定。
 */
public interface ProfileClient {

    /**
     * @return 账号资料；目录中没有该用户时为空
     */
    Optional<ExternalProfile> fetchProfile(String externalHandle);

    CatalogSnapshot fetchCatalogSnapshot(String externalHandle);
}
