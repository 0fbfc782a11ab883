package com.guildpool.core.reward;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.ErrorCode;
import com.guildpool.core.domain.GuildpoolException;
import com.guildpool.core.external.GroupLifecycle;
import com.guildpool.core.external.ServiceRoster;
import com.guildpool.core.round.RoundClock;
import com.guildpool.core.round.RoundHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Roster of group owners enrolled in the reward service, versioned by round.
 */
public class ServiceEnrollment implements ServiceRoster {

    private static final Logger log = LoggerFactory.getLogger(ServiceEnrollment.class);

    private final GroupLifecycle lifecycle;
    private final RoundClock roundClock;
    private final Map<EnrollmentKey, RoundHistory<Boolean>> enrollments = new HashMap<>();

    public ServiceEnrollment(GroupLifecycle lifecycle, RoundClock roundClock) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "Group lifecycle cannot be null");
        this.roundClock = Objects.requireNonNull(roundClock, "Round clock cannot be null");
    }

    /**
     * Enrolls an owner of at least one active group. Enrolling again while enrolled changes nothing.
     *
     * @return true if the account was newly enrolled
     */
    public synchronized boolean join(ActivityKey activity, Address account) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Objects.requireNonNull(account, "Account cannot be null");
        if (lifecycle.activeGroupIdsOwnedBy(activity, account).isEmpty()) {
            throw GuildpoolException.of(ErrorCode.NO_ACTIVE_GROUPS,
                    account + " owns no active group in " + activity);
        }
        if (isEnrolled(activity, account)) {
            return false;
        }
        long round = roundClock.currentRound();
        enrollments.computeIfAbsent(new EnrollmentKey(activity, account), k -> new RoundHistory<>())
                .record(round, Boolean.TRUE);
        log.info("{} joined the reward service of {} at round {}", account, activity, round);
        return true;
    }

    public synchronized void exit(ActivityKey activity, Address account) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Objects.requireNonNull(account, "Account cannot be null");
        if (!isEnrolled(activity, account)) {
            throw GuildpoolException.of(ErrorCode.NOT_JOINED,
                    account + " has not joined the reward service of " + activity);
        }
        long round = roundClock.currentRound();
        enrollments.get(new EnrollmentKey(activity, account)).record(round, Boolean.FALSE);
        log.info("{} exited the reward service of {} at round {}", account, activity, round);
    }

    public synchronized boolean isEnrolled(ActivityKey activity, Address account) {
        RoundHistory<Boolean> history = enrollments.get(new EnrollmentKey(activity, account));
        return history != null && history.latest().orElse(Boolean.FALSE);
    }

    public synchronized List<Address> enrolledAccounts(ActivityKey activity) {
        return enrollments.entrySet().stream()
                .filter(e -> e.getKey().activity().equals(activity))
                .filter(e -> e.getValue().latest().orElse(Boolean.FALSE))
                .map(e -> e.getKey().account())
                .sorted()
                .toList();
    }

    @Override
    public synchronized boolean isAccountOnRosterAtRound(ActivityKey activity, Address account, long round) {
        RoundHistory<Boolean> history = enrollments.get(new EnrollmentKey(activity, account));
        return history != null && history.valueAt(round).isPresent();
    }

    @Override
    public synchronized boolean hasExitedByRound(ActivityKey activity, Address account, long round) {
        RoundHistory<Boolean> history = enrollments.get(new EnrollmentKey(activity, account));
        return history != null && Boolean.FALSE.equals(history.valueAt(round).orElse(null));
    }

    private record EnrollmentKey(ActivityKey activity, Address account) {}
}
