// =====================================================
// ExtensionDispatcher - 익스텐션 훅 호출
// =====================================================
// 역할: 등록된 익스텐션과 훅 마스크를 보관하고 before/after 훅을 호출
//
// 호출 규칙:
// 1. 풀에 익스텐션이 없으면 호출 없음
// 2. 등록 시 고른 훅(CallPoints)만 호출
// 3. 호출자(locker)가 익스텐션 자신이면 호출하지 않음 (재귀 방지)
// 4. 엔진 예외(AmmException)는 그대로 전파
//    그 외 예외는 ExtensionCallFailedException으로 감싸서 전파
//
// 등록 정보는 저널에 기록되지 않습니다 (등록은 lock 밖에서 수행).
// =====================================================

package dustin.amm.domains.engine.extension;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;

import dustin.amm.domains.engine.exception.AmmException;
import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.ExtensionCallFailedException;
import dustin.amm.domains.engine.exception.ValidationException;
import dustin.amm.domains.engine.pool.PoolKey;
import lombok.extern.slf4j.Slf4j;

/**
 * 익스텐션 디스패처
 * Extension dispatcher
 */
@Slf4j
public class ExtensionDispatcher {

    /**
     * 등록된 익스텐션
     */
    private static class Registration {
        private final Extension extension;
        private final CallPoints callPoints;

        Registration(Extension extension, CallPoints callPoints) {
            this.extension = extension;
            this.callPoints = callPoints;
        }
    }

    private final Map<String, Registration> registrations = new HashMap<>();

    /**
     * 익스텐션 등록
     *
     * @throws ValidationException 중복 등록(EXTENSION_ALREADY_REGISTERED) 또는 빈 마스크(INVALID_CALL_POINTS)
     */
    public void register(Extension extension, CallPoints callPoints) {
        if (callPoints == null || callPoints.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_CALL_POINTS,
                    String.format("Extension must subscribe to at least one call point: %s", extension.getAddress()));
        }
        if (registrations.containsKey(extension.getAddress())) {
            throw new ValidationException(ErrorCode.EXTENSION_ALREADY_REGISTERED,
                    String.format("Extension already registered: %s", extension.getAddress()));
        }
        registrations.put(extension.getAddress(), new Registration(extension, callPoints));
        log.info("[ExtensionDispatcher] 익스텐션 등록: address={}, callPoints={}",
                extension.getAddress(), Integer.toBinaryString(callPoints.toMask()));
    }

    public boolean isRegistered(String address) {
        return registrations.containsKey(address);
    }

    /**
     * 등록된 훅 목록 (없으면 null)
     */
    public CallPoints getCallPoints(String address) {
        Registration registration = registrations.get(address);
        return registration == null ? null : registration.callPoints;
    }

    /**
     * 풀 익스텐션이 등록되어 있는지 확인
     *
     * @throws ValidationException EXTENSION_NOT_REGISTERED
     */
    public void requireRegistered(PoolKey poolKey) {
        if (poolKey.hasExtension() && !registrations.containsKey(poolKey.getExtension())) {
            throw new ValidationException(ErrorCode.EXTENSION_NOT_REGISTERED,
                    String.format("Extension not registered: %s", poolKey.getExtension()));
        }
    }

    /**
     * 훅 호출
     *
     * @param caller 현재 locker (익스텐션 자신이면 건너뜀)
     * @param poolKey 풀 키
     * @param enabled 해당 훅이 마스크에 있는지
     * @param hookName 로그/오류 메시지용 훅 이름
     * @param hook 실제 호출
     */
    public void dispatch(String caller, PoolKey poolKey, Predicate<CallPoints> enabled, String hookName,
                         Consumer<Extension> hook) {
        if (!poolKey.hasExtension() || poolKey.getExtension().equals(caller)) {
            return;
        }
        Registration registration = registrations.get(poolKey.getExtension());
        if (registration == null || !enabled.test(registration.callPoints)) {
            return;
        }

        try {
            hook.accept(registration.extension);
        } catch (AmmException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[ExtensionDispatcher] 훅 실패: extension={}, hook={}, error={}",
                    poolKey.getExtension(), hookName, e.getMessage());
            throw new ExtensionCallFailedException(
                    String.format("Extension %s failed in %s: %s", poolKey.getExtension(), hookName, e.getMessage()), e);
        }
    }
}
