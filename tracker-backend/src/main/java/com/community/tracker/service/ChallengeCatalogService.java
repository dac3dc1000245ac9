package com.community.tracker.service;

import com.community.tracker.dto.ChallengeDefinitionDTO;
import com.community.tracker.dto.SelectionDTO;
import com.community.tracker.dto.SelectionOverrides;
import com.community.tracker.scope.ScopeToken;

import java.util.List;

public interface ChallengeCatalogService {

    ChallengeDefinitionDTO createDefinition(ChallengeDefinitionDTO definition);

    /**
     * 把 {@code changes} 中非 null 的字段应用到已有定义上，键不可修改
     */
    ChallengeDefinitionDTO correctDefinition(String definitionKey, ChallengeDefinitionDTO changes);

    List<ChallengeDefinitionDTO> listDefinitions();

    ChallengeDefinitionDTO getDefinition(String definitionKey);

    SelectionDTO selectChallenge(ScopeToken token, String definitionKey, SelectionOverrides overrides);

    SelectionDTO updateSelection(ScopeToken token, String definitionKey, SelectionOverrides overrides);

    List<SelectionDTO> listSelections(ScopeToken token);

    /**
     * 删除选用记录，以及令牌社区中该挑战的全部进度记录
     *
     * @return 删除的进度记录数
     */
    int removeSelection(ScopeToken token, String definitionKey);
}
