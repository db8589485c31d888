/**
 * Account registration lifecycle.
 *
 * <p>A registration request passes an ordered guard chain (email uniqueness,
 * password policy, referral code) before the account moves to Registered.
 * External lookups go through the {@link com.ryuqq.lifecycle.sample.registration.UserDirectory} port.</p>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.sample.registration;
