package com.community.tracker.controller;

/**
 * 机器人进程每次调用都会携带的请求头。REST 层不做认证，
 * 由机器人告知操作者身份，以及平台是否认定其为社区管理员。
 */
final class ApiHeaders {

    static final String PERSON_ID = "X-Person-Id";

    static final String PLATFORM_ADMIN = "X-Platform-Admin";

    private ApiHeaders() {
    }
}
