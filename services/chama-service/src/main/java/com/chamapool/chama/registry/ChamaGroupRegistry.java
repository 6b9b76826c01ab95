package com.chamapool.chama.registry;

import com.chamapool.chama.domain.ContributionAsset;
import com.chamapool.chama.domain.GroupRules;
import com.chamapool.chama.domain.PunishmentAction;
import com.chamapool.chama.engine.ChamaEvent;
import com.chamapool.chama.engine.ChamaEventType;
import com.chamapool.chama.engine.ChamaGroupEngine;
import com.chamapool.chama.engine.EngineSettings;
import com.chamapool.chama.engine.GroupEventListener;
import com.chamapool.chama.engine.ValueTransferGateway;
import com.chamapool.chama.exception.ChamaAuthorizationException;
import com.chamapool.chama.exception.GroupCapacityException;
import com.chamapool.chama.exception.GroupIntegrityException;
import com.chamapool.chama.exception.GroupNotFoundException;
import com.chamapool.chama.exception.GroupPreconditionException;
import com.chamapool.chama.exception.InvalidGroupParametersException;
import com.chamapool.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Creates groups and keeps track of them.
 *
 * Creation parameters are checked against {@link RegistrySettings}; each creator may own a
 * bounded number of groups. The registry owner can pause creation globally. Groups are kept
 * in memory for the lifetime of the service.
 */
@Slf4j
public class ChamaGroupRegistry {

    private final RegistrySettings registrySettings;
    private final EngineSettings engineSettings;
    private final Clock clock;
    private final ValueTransferGateway transferGateway;
    private final GroupEventListener eventListener;

    private final ReentrantLock creationLock = new ReentrantLock();
    private final Map<String, ChamaGroupEngine> groups = new ConcurrentHashMap<>();
    private final Map<String, List<String>> groupsByCreator = new ConcurrentHashMap<>();
    private volatile boolean paused;
    private long groupCounter;

    public ChamaGroupRegistry(RegistrySettings registrySettings,
                              EngineSettings engineSettings,
                              Clock clock,
                              ValueTransferGateway transferGateway,
                              GroupEventListener eventListener) {
        this.registrySettings = registrySettings;
        this.engineSettings = engineSettings;
        this.clock = clock;
        this.transferGateway = transferGateway;
        this.eventListener = eventListener != null ? eventListener : GroupEventListener.NO_OP;
    }

    /**
     * Validates the rules and creates a new group owned by {@code creator}.
     */
    public ChamaGroupEngine createGroup(String creator, GroupRules requested) {
        if (creator == null || creator.isBlank()) {
            throw new GroupIntegrityException(ErrorCode.GROUP_INVALID_ADDRESS);
        }
        ChamaGroupEngine engine;
        creationLock.lock();
        try {
            if (paused) {
                throw new GroupPreconditionException(ErrorCode.REGISTRY_PAUSED);
            }
            Instant now = clock.instant();
            GroupRules rules = normalize(requested);
            validate(rules, now);

            List<String> owned = groupsByCreator.getOrDefault(creator, Collections.emptyList());
            if (owned.size() >= registrySettings.getMaxGroupsPerCreator()) {
                throw new GroupCapacityException(ErrorCode.REGISTRY_TOO_MANY_GROUPS,
                        "Creator already owns " + owned.size() + " groups");
            }

            String groupId = String.valueOf(++groupCounter);
            engine = new ChamaGroupEngine(groupId, creator, rules, engineSettings, clock, transferGateway, eventListener);
            groups.put(groupId, engine);
            groupsByCreator.computeIfAbsent(creator, k -> new CopyOnWriteArrayList<>()).add(groupId);
            log.info("Group created: id={}, name={}, creator={}, contribution={} {}, maxMembers={}",
                    groupId, rules.getName(), creator, rules.getContributionAmount(),
                    rules.getContributionAsset().code(), rules.getMaxMembers());
        } finally {
            creationLock.unlock();
        }

        publishCreated(engine, creator);
        return engine;
    }

    public ChamaGroupEngine getGroup(String groupId) {
        return findGroup(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
    }

    public Optional<ChamaGroupEngine> findGroup(String groupId) {
        return groupId == null ? Optional.empty() : Optional.ofNullable(groups.get(groupId));
    }

    public List<String> getGroupsByCreator(String creator) {
        return List.copyOf(groupsByCreator.getOrDefault(creator, Collections.emptyList()));
    }

    public List<ChamaGroupEngine> getAllGroups() {
        List<ChamaGroupEngine> all = new ArrayList<>(groups.values());
        all.sort((a, b) -> Long.compare(Long.parseLong(a.getGroupId()), Long.parseLong(b.getGroupId())));
        return all;
    }

    public long getGroupCount() {
        creationLock.lock();
        try {
            return groupCounter;
        } finally {
            creationLock.unlock();
        }
    }

    public void pause(String caller) {
        requireOwner(caller);
        if (paused) {
            throw new GroupPreconditionException(ErrorCode.REGISTRY_PAUSED);
        }
        paused = true;
        log.warn("Registry paused by {}", caller);
    }

    public void unpause(String caller) {
        requireOwner(caller);
        if (!paused) {
            throw new GroupPreconditionException(ErrorCode.REGISTRY_NOT_PAUSED);
        }
        paused = false;
        log.info("Registry unpaused by {}", caller);
    }

    public boolean isPaused() {
        return paused;
    }

    public String getOwner() {
        return registrySettings.getOwner();
    }

    private GroupRules normalize(GroupRules rules) {
        if (rules == null) {
            throw new InvalidGroupParametersException(ErrorCode.VALIDATION_FAILED, "Group rules are required");
        }
        return rules.toBuilder()
                .name(rules.getName() != null ? rules.getName().trim() : null)
                .punishmentMode(rules.getPunishmentMode() != null ? rules.getPunishmentMode() : PunishmentAction.NONE)
                .contributionAsset(rules.getContributionAsset() != null ? rules.getContributionAsset() : ContributionAsset.NATIVE)
                .build();
    }

    private void validate(GroupRules rules, Instant now) {
        String name = rules.getName();
        if (name == null || name.length() < registrySettings.getMinNameLength()
                || name.length() > registrySettings.getMaxNameLength()) {
            throw new InvalidGroupParametersException(ErrorCode.REGISTRY_INVALID_NAME);
        }

        BigDecimal amount = rules.getContributionAmount();
        if (amount == null || amount.compareTo(registrySettings.getMinContribution()) < 0
                || amount.compareTo(registrySettings.getMaxContribution()) > 0) {
            throw new InvalidGroupParametersException(ErrorCode.REGISTRY_INVALID_CONTRIBUTION);
        }
        if (rules.getFineAmount() != null && rules.getFineAmount().signum() < 0) {
            throw new InvalidGroupParametersException(ErrorCode.REGISTRY_INVALID_CONTRIBUTION,
                    "Fine amount must not be negative");
        }

        if (rules.getMaxMembers() < registrySettings.getMinMembers()
                || rules.getMaxMembers() > registrySettings.getMaxMembers()) {
            throw new InvalidGroupParametersException(ErrorCode.REGISTRY_INVALID_MAX_MEMBERS);
        }

        if (rules.getStartDate() == null || !rules.getStartDate().isAfter(now)) {
            throw new InvalidGroupParametersException(ErrorCode.REGISTRY_START_IN_PAST);
        }
        if (rules.getEndDate() == null || !rules.getEndDate().isAfter(rules.getStartDate())
                || rules.getEndDate().isAfter(now.plus(registrySettings.getMaxGroupDuration()))) {
            throw new InvalidGroupParametersException(ErrorCode.REGISTRY_INVALID_END_DATE);
        }

        if (isNegative(rules.getContributionWindow()) || isNegative(rules.getGracePeriod())) {
            throw new InvalidGroupParametersException(ErrorCode.REGISTRY_INVALID_WINDOW);
        }
    }

    private void publishCreated(ChamaGroupEngine engine, String creator) {
        ChamaEvent event = ChamaEvent.builder()
                .type(ChamaEventType.GROUP_CREATED)
                .groupId(engine.getGroupId())
                .member(creator)
                .amount(engine.getRules().getContributionAmount())
                .reason(engine.getRules().getName())
                .occurredAt(clock.instant())
                .build();
        try {
            eventListener.onEvent(event);
        } catch (RuntimeException e) {
            log.error("Failed to dispatch GROUP_CREATED event for group {}", engine.getGroupId(), e);
        }
    }

    private void requireOwner(String caller) {
        String owner = registrySettings.getOwner();
        if (caller == null || owner == null || !owner.equals(caller)) {
            throw new ChamaAuthorizationException(ErrorCode.REGISTRY_NOT_OWNER);
        }
    }

    private static boolean isNegative(Duration duration) {
        return duration != null && duration.isNegative();
    }
}
