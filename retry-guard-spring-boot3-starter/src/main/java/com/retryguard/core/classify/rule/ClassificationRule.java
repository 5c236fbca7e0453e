package com.retryguard.core.classify.rule;

import com.retryguard.core.classify.ClassifierSettings;
import com.retryguard.model.Classification;

/**
 * 有序分类规则，按顺序首个 supports 的规则产出分类
 */
public interface ClassificationRule {

    /** 是否匹配 */
    boolean supports(Object error);

    /** 产出分类 */
    Classification classify(ClassifierSettings settings);
}
