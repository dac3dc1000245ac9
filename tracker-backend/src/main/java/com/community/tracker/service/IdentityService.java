package com.community.tracker.service;

import com.community.tracker.dto.PersonDTO;
import com.community.tracker.dto.ProfileDTO;

public interface IdentityService {

    /**
     * 首次注册时创建成员，之后返回已有成员
     */
    PersonDTO registerPerson(Long externalUserId, String displayName);

    PersonDTO getPerson(Long personId);

    PersonDTO findByExternalUserId(Long externalUserId);

    /**
     * 先向外部目录核实账号，再进行绑定（覆盖之前的账号）
     */
    PersonDTO linkProfile(Long personId, String externalHandle);

    ProfileDTO getProfile(Long personId);

    void unlinkProfile(Long personId);
}
