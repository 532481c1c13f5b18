package com.ryuqq.fanout.core.contract;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Message 사본에 연결되는 취소 가능한 실행 컨텍스트.
 *
 * <p>엔진은 전송 시도마다 원본 컨텍스트에서 파생된 자식 컨텍스트를 사본에 붙이고,
 * 해당 시도가 끝나면 취소합니다. Consumer는 {@link #isCancelled()}나
 * {@link #cancelled()}로 처리를 중단할 시점을 알 수 있습니다.</p>
 *
 * <p><strong>취소 전파:</strong></p>
 * <ul>
 *   <li>부모가 취소되면 모든 자식이 취소됨</li>
 *   <li>자식 취소는 부모에 영향 없음</li>
 *   <li>취소된 자식은 부모의 자식 목록에서 제거됨 (부모가 오래 살아도 누적되지 않음)</li>
 *   <li>{@link #background()}는 절대 취소되지 않음</li>
 * </ul>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public final class MessageContext {

    private static final MessageContext BACKGROUND = new MessageContext(null, false);

    private final MessageContext parent;
    private final CompletableFuture<Void> done;
    private final boolean cancellable;
    private final Set<MessageContext> children;

    private MessageContext(MessageContext parent, boolean cancellable) {
        this.done = new CompletableFuture<>();
        this.cancellable = cancellable;
        this.children = ConcurrentHashMap.newKeySet();
        // background는 완료되지 않으므로 자식을 추적하지 않음
        this.parent = parent != null && parent.cancellable ? parent : null;
        if (this.parent != null) {
            this.parent.children.add(this);
            if (this.parent.isCancelled()) {
                cancel();
            }
        }
    }

    /**
     * 취소되지 않는 루트 컨텍스트.
     *
     * @return background 컨텍스트
     */
    public static MessageContext background() {
        return BACKGROUND;
    }

    /**
     * 이 컨텍스트에서 파생된 취소 가능한 자식 컨텍스트 생성.
     *
     * @return 새 자식 컨텍스트
     */
    public MessageContext withCancel() {
        return new MessageContext(this, true);
    }

    /**
     * 컨텍스트 취소 (멱등).
     *
     * <p>background 컨텍스트에 대한 호출은 무시됩니다.</p>
     */
    public void cancel() {
        if (!cancellable || !done.complete(null)) {
            return;
        }
        if (parent != null) {
            parent.children.remove(this);
        }
        for (MessageContext child : children) {
            child.cancel();
        }
        children.clear();
    }

    public boolean isCancelled() {
        return done.isDone();
    }

    /**
     * 취소 시 완료되는 stage.
     *
     * @return 취소 알림 stage
     */
    public CompletionStage<Void> cancelled() {
        return done.minimalCompletionStage();
    }

    /**
     * 아직 취소되지 않은 자식 수. 테스트 검증용.
     */
    int activeChildCount() {
        return children.size();
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "MessageContext{background}";
        }
        return "MessageContext{cancelled=" + isCancelled() + '}';
    }
}
