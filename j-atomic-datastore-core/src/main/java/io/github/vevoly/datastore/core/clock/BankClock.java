package io.github.vevoly.datastore.core.clock;

import io.github.vevoly.datastore.api.constants.JAtomicDataStoreConstant;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <h3>银行虚拟时钟 (Bank Clock)</h3>
 *
 * <p>
 * 模拟系统的统一时间源。交易时间戳、NACH 编号中的日期都取自这里。
 * 支持把时间拨到任意时刻或向前推进，用于模拟月末扣费、账单日等场景；未拨动时跟随系统时钟。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Bank Clock.</b><br>
 * Single time source of the simulation. Transaction timestamps and the date stamp of NACH ids come from here.
 * Time can be pinned or advanced to simulate month ends and billing days; otherwise it follows the wall clock.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class BankClock {

    public static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern(JAtomicDataStoreConstant.DATETIME_PATTERN);
    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern(JAtomicDataStoreConstant.DATE_PATTERN);

    private final Clock baseClock;

    // 相对底层时钟的偏移量 / Offset from the underlying clock
    private final AtomicReference<Duration> offset = new AtomicReference<>(Duration.ZERO);

    public BankClock() {
        this(Clock.systemDefaultZone());
    }

    public BankClock(Clock baseClock) {
        this.baseClock = baseClock;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(baseClock).plus(offset.get());
    }

    public LocalDate today() {
        return now().toLocalDate();
    }

    /**
     * 交易时间戳格式 dd-MM-yyyy HH:mm:ss / Transaction timestamp format
     */
    public String formattedDateTime() {
        return now().format(DATETIME_FORMAT);
    }

    public String formattedDate() {
        return now().format(DATE_FORMAT);
    }

    /**
     * 将虚拟时间设置为指定时刻.
     * <br>
     * <span style="color: gray;">Pin virtual time to the given instant.</span>
     */
    public void set(LocalDateTime target) {
        offset.set(Duration.between(LocalDateTime.now(baseClock), target));
        log.info("银行时钟已设置为 {} / Bank clock set to {}", target, target);
    }

    /**
     * 推进虚拟时间.
     * <br>
     * <span style="color: gray;">Advance virtual time.</span>
     */
    public void advance(Duration amount) {
        Duration updated = offset.updateAndGet(current -> current.plus(amount));
        log.debug("银行时钟推进 {}，当前偏移 {} / Bank clock advanced by {}, offset now {}", amount, updated, amount, updated);
    }

    public void advanceDays(long days) {
        advance(Duration.ofDays(days));
    }

    /**
     * 恢复为系统时间 / Back to wall-clock time
     */
    public void reset() {
        offset.set(Duration.ZERO);
    }
}
