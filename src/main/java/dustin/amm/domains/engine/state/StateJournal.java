// =====================================================
// StateJournal - 되돌리기 로그 (undo log)
// =====================================================
// 역할: lock / forward / initializePool 같은 진입 호출을
//       "전부 성공 또는 전부 취소"로 만들어 주는 저장소 공용 저널
//
// 핵심 설계:
// 1. 모든 상태 저장소(JournaledMap)는 값을 바꿀 때 되돌리기 작업을 기록
// 2. atomically() 진입 시 현재 로그 길이를 세이브포인트로 기억
// 3. 예외 발생 시 세이브포인트 이후 기록을 역순으로 실행 → 원상 복구
// 4. 가장 바깥 호출이 끝나면 로그 비움 (더 이상 되돌릴 일 없음)
//
// 자료구조:
// 1. ArrayList<Runnable>
//    - 추가: O(1) amortized
//    - 롤백: 세이브포인트 이후 항목 수만큼 O(k)
//
// 중첩:
// - lock 안의 lock, forward 모두 자신의 세이브포인트를 가짐
// - 안쪽 실패는 안쪽 변경만 취소하고, 바깥에서 예외를 잡으면 바깥은 계속 진행 가능
// =====================================================

package dustin.amm.domains.engine.state;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * 상태 변경 저널
 * Undo log shared by every engine store
 */
public class StateJournal {

    private final List<Runnable> undoLog = new ArrayList<>();

    /**
     * 현재 열린 atomically() 깊이
     */
    private int depth;

    /**
     * 되돌리기 작업 기록
     * 트랜잭션 밖(depth == 0)에서의 변경은 기록하지 않습니다.
     */
    public void record(Runnable undo) {
        if (depth > 0) {
            undoLog.add(undo);
        }
    }

    /**
     * 원자적 실행
     *
     * @param action 실행할 작업
     * @return 작업 결과
     * @throws RuntimeException 작업이 던진 예외 그대로 (상태는 롤백된 뒤)
     */
    public <T> T atomically(Supplier<T> action) {
        int savepoint = undoLog.size();
        depth++;
        try {
            return action.get();
        } catch (RuntimeException | Error e) {
            rollbackTo(savepoint);
            throw e;
        } finally {
            depth--;
            if (depth == 0) {
                undoLog.clear();
            }
        }
    }

    /**
     * 반환값 없는 작업용
     */
    public void atomically(Runnable action) {
        atomically(() -> {
            action.run();
            return null;
        });
    }

    public boolean isActive() {
        return depth > 0;
    }

    /**
     * 현재 로그 길이 (테스트 / 디버깅용)
     */
    public int size() {
        return undoLog.size();
    }

    private void rollbackTo(int savepoint) {
        for (int i = undoLog.size() - 1; i >= savepoint; i--) {
            undoLog.remove(i).run();
        }
    }
}
