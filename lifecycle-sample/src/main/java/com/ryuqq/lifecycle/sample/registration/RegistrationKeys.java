package com.ryuqq.lifecycle.sample.registration;

import com.ryuqq.lifecycle.core.context.ContextKey;

/**
 * 가입 요청 컨텍스트 키.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class RegistrationKeys {

    public static final ContextKey<String> EMAIL = ContextKey.of("email", String.class);
    public static final ContextKey<String> PASSWORD = ContextKey.of("password", String.class);
    /** 선택 항목. */
    public static final ContextKey<String> REFERRAL_CODE = ContextKey.of("referralCode", String.class);

    private RegistrationKeys() {
    }
}
