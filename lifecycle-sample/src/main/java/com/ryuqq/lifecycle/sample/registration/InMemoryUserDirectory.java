package com.ryuqq.lifecycle.sample.registration;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory UserDirectory 구현체.
 *
 * <p>테스트와 샘플 실행용입니다. 데이터는 프로세스 종료 시 사라집니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InMemoryUserDirectory implements UserDirectory {

    private final Map<String, String> accountIdsByEmail = new ConcurrentHashMap<>();
    private final Map<String, List<String>> referralUses = new ConcurrentHashMap<>();

    @Override
    public boolean emailExists(String email) {
        return email != null && accountIdsByEmail.containsKey(normalize(email));
    }

    @Override
    public boolean referralCodeExists(String referralCode) {
        return referralCode != null && referralUses.containsKey(referralCode);
    }

    @Override
    public void recordRegistration(String accountId, String email) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be null or blank");
        }
        String existing = accountIdsByEmail.putIfAbsent(normalize(email), accountId);
        if (existing != null && !existing.equals(accountId)) {
            throw new IllegalStateException("Email " + email + " already registered by " + existing);
        }
    }

    @Override
    public void recordReferralUse(String referralCode, String accountId) {
        List<String> uses = referralUses.get(referralCode);
        if (uses == null) {
            throw new IllegalStateException("Unknown referral code: " + referralCode);
        }
        uses.add(accountId);
    }

    /**
     * 추천 코드 발급.
     *
     * @param referralCode 추천 코드
     */
    public void issueReferralCode(String referralCode) {
        if (referralCode == null || referralCode.isBlank()) {
            throw new IllegalArgumentException("referralCode cannot be null or blank");
        }
        referralUses.putIfAbsent(referralCode, new CopyOnWriteArrayList<>());
    }

    /**
     * 이메일로 계정 ID 조회.
     *
     * @param email 이메일
     * @return 계정 ID (없으면 empty)
     */
    public Optional<String> findAccountId(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(accountIdsByEmail.get(normalize(email)));
    }

    /**
     * 추천 코드를 사용한 계정 목록.
     *
     * @param referralCode 추천 코드
     * @return 계정 ID 목록 (불변)
     */
    public List<String> referralUses(String referralCode) {
        List<String> uses = referralUses.get(referralCode);
        return uses == null ? List.of() : List.copyOf(uses);
    }

    public int size() {
        return accountIdsByEmail.size();
    }

    /**
     * 모든 데이터 삭제 (테스트 격리용).
     */
    public void clear() {
        accountIdsByEmail.clear();
        referralUses.clear();
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
