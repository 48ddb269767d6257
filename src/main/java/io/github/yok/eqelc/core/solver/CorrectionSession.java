package io.github.yok.eqelc.core.solver;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;

/**
 * 対話的なフロントエンドから繰り返し要求される LC 補正を、1 論理セッション単位で実行するクラスです。
 *
 * <p>
 * 新しいパラメータで {@link #submit(CorrectionInput)} すると、同じセッションで実行中の補正は割り込みで取り消されます（最新パラメータ優先）。
 * 途中結果は公開しません。 セッションごとに専用のスレッドを 1 本持ちます。
 * </p>
 */
@Slf4j
public final class CorrectionSession implements AutoCloseable {

    /**
     * 補正器です。
     */
    private final EqeCorrector corrector;

    /**
     * 補正を実行するスレッドです。
     */
    private final ListeningExecutorService executor;

    /**
     * 最後に投入した補正です。
     */
    private ListenableFuture<CorrectionResultSet> latest;

    /**
     * クローズ済みかどうかです。
     */
    private boolean closed;

    /**
     * セッションを生成します。
     *
     * @param corrector 補正器です（null 不可）
     */
    public CorrectionSession(EqeCorrector corrector) {
        this.corrector = checkNotNull(corrector, "corrector は null 不可です");
        this.executor = MoreExecutors.listeningDecorator(Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("eqelc-correction-%d").setDaemon(true)
                        .build()));
    }

    /**
     * 補正を投入します。実行中の前回の補正は取り消されます。
     *
     * @param input 入力スナップショットです（null 不可）
     * @return 補正結果の Future です
     * @throws IllegalStateException クローズ済みの場合に発生します
     */
    public synchronized ListenableFuture<CorrectionResultSet> submit(CorrectionInput input) {
        checkNotNull(input, "input は null 不可です");
        if (closed) {
            throw new IllegalStateException("セッションはクローズ済みです");
        }
        if (latest != null && !latest.isDone()) {
            latest.cancel(true);
            log.info("実行中のLC補正を取り消しました（新しいパラメータを優先します）");
        }
        latest = executor.submit(() -> corrector.correct(input));
        return latest;
    }

    /**
     * 実行中の補正を取り消し、スレッドを停止します。
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (latest != null && !latest.isDone()) {
            latest.cancel(true);
        }
        executor.shutdownNow();
    }
}
