package com.chamapool.chama.engine;

import com.chamapool.chama.domain.ContributionAsset;
import com.chamapool.chama.domain.JoinOutcome;
import com.chamapool.chama.domain.Member;
import com.chamapool.chama.domain.PunishmentAction;
import com.chamapool.chama.exception.ChamaAuthorizationException;
import com.chamapool.chama.exception.GroupCapacityException;
import com.chamapool.chama.exception.GroupIntegrityException;
import com.chamapool.chama.exception.GroupPreconditionException;
import com.chamapool.chama.exception.ValueTransferException;
import com.chamapool.chama.support.RecordingTransferGateway.Transfer;
import com.chamapool.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ChamaGroupEngine Membership Tests")
class ChamaGroupEngineMembershipTest extends AbstractGroupEngineTest {

    @Nested
    @DisplayName("Joining")
    class JoiningTests {

        @Test
        @DisplayName("Should admit a member once the group has started")
        void shouldAdmitMember() {
            // Arrange
            ChamaGroupEngine engine = engine();
            atStartOf(0);

            // Act
            JoinOutcome outcome = engine.join(ALICE);

            // Assert
            assertThat(outcome).isEqualTo(JoinOutcome.ADMITTED);
            assertThat(engine.getMemberCount()).isEqualTo(1);
            assertThat(engine.getActiveMemberCount()).isEqualTo(1);
            Member alice = engine.getMemberDetails(ALICE).orElseThrow();
            assertThat(alice.isActive()).isTrue();
            assertThat(alice.getJoinedAt()).isEqualTo(clock.instant());
            assertThat(alice.getTotalContributed()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(events.types()).containsExactly(ChamaEventType.MEMBER_JOINED);
        }

        @Test
        @DisplayName("Should not make the creator a member")
        void shouldNotMakeCreatorMember() {
            ChamaGroupEngine engine = engine();

            assertThat(engine.getMemberDetails(CREATOR)).isEmpty();
            assertThat(engine.isAdmin(CREATOR)).isTrue();
            assertThat(engine.getMemberCount()).isZero();
        }

        @Test
        @DisplayName("Should reject joining before the start date")
        void shouldRejectJoinBeforeStart() {
            ChamaGroupEngine engine = engine();

            assertRejected(() -> engine.join(ALICE), GroupPreconditionException.class, ErrorCode.GROUP_NOT_STARTED);
            assertThat(engine.getMemberCount()).isZero();
        }

        @Test
        @DisplayName("Should reject joining after the end date")
        void shouldRejectJoinAfterEnd() {
            ChamaGroupEngine engine = engine();
            clock.set(START.plus(Duration.ofDays(181)));

            assertRejected(() -> engine.join(ALICE), GroupPreconditionException.class, ErrorCode.GROUP_ENDED);
        }

        @Test
        @DisplayName("Should reject a second join by the same member")
        void shouldRejectDuplicateJoin() {
            ChamaGroupEngine engine = engine();
            atStartOf(0);
            engine.join(ALICE);

            assertRejected(() -> engine.join(ALICE), GroupPreconditionException.class, ErrorCode.GROUP_ALREADY_MEMBER);
            assertThat(engine.getMemberCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should reject joining a full group")
        void shouldRejectJoinWhenFull() {
            ChamaGroupEngine engine = engine(rules().maxMembers(3).build());
            atStartOf(0);
            joinAll(engine, ALICE, BOB, CAROL);

            assertRejected(() -> engine.join(DAVE), GroupCapacityException.class, ErrorCode.GROUP_FULL);
        }

        @Test
        @DisplayName("Should count departed members against capacity")
        void shouldCountLeftMembersAgainstCapacity() {
            ChamaGroupEngine engine = engine(rules().maxMembers(3).build());
            atStartOf(0);
            joinAll(engine, ALICE, BOB, CAROL);
            engine.leave(CAROL);

            assertRejected(() -> engine.join(DAVE), GroupCapacityException.class, ErrorCode.GROUP_FULL);
            assertRejected(() -> engine.join(CAROL), GroupPreconditionException.class, ErrorCode.GROUP_ALREADY_MEMBER);
        }

        @Test
        @DisplayName("Should reject a blank identity")
        void shouldRejectBlankIdentity() {
            ChamaGroupEngine engine = engine();
            atStartOf(0);

            assertRejected(() -> engine.join(" "), GroupIntegrityException.class, ErrorCode.GROUP_INVALID_ADDRESS);
        }
    }

    @Nested
    @DisplayName("Join approval")
    class JoinApprovalTests {

        @Test
        @DisplayName("Should record a join request instead of admitting")
        void shouldRecordJoinRequest() {
            // Arrange
            ChamaGroupEngine engine = engine(rules().approvalRequired(true).build());
            atStartOf(0);

            // Act
            JoinOutcome outcome = engine.join(ALICE);

            // Assert
            assertThat(outcome).isEqualTo(JoinOutcome.REQUESTED);
            assertThat(engine.hasPendingJoinRequest(ALICE)).isTrue();
            assertThat(engine.getMemberCount()).isZero();
            assertThat(events.types()).containsExactly(ChamaEventType.JOIN_REQUESTED);
            assertRejected(() -> engine.join(ALICE), GroupPreconditionException.class,
                    ErrorCode.GROUP_JOIN_ALREADY_REQUESTED);
        }

        @Test
        @DisplayName("Should admit a requester when an admin approves")
        void shouldAdmitOnApproval() {
            ChamaGroupEngine engine = engine(rules().approvalRequired(true).build());
            atStartOf(0);
            engine.join(ALICE);

            engine.approveJoin(CREATOR, ALICE);

            assertThat(engine.hasPendingJoinRequest(ALICE)).isFalse();
            assertThat(engine.getMemberDetails(ALICE)).get().extracting(Member::isActive).isEqualTo(true);
            assertThat(events.types()).containsExactly(
                    ChamaEventType.JOIN_REQUESTED, ChamaEventType.JOIN_APPROVED, ChamaEventType.MEMBER_JOINED);
            assertThat(events.ofType(ChamaEventType.JOIN_APPROVED).get(0).getCounterparty()).isEqualTo(CREATOR);
        }

        @Test
        @DisplayName("Should only let admins approve or reject")
        void shouldRequireAdminToDecide() {
            ChamaGroupEngine engine = engine(rules().approvalRequired(true).build());
            atStartOf(0);
            engine.join(ALICE);

            assertRejected(() -> engine.approveJoin(BOB, ALICE), ChamaAuthorizationException.class,
                    ErrorCode.GROUP_NOT_ADMIN);
            assertRejected(() -> engine.rejectJoin(BOB, ALICE), ChamaAuthorizationException.class,
                    ErrorCode.GROUP_NOT_ADMIN);
            assertThat(engine.hasPendingJoinRequest(ALICE)).isTrue();
        }

        @Test
        @DisplayName("Should reject deciding on a request that does not exist")
        void shouldRejectUnknownRequest() {
            ChamaGroupEngine engine = engine(rules().approvalRequired(true).build());
            atStartOf(0);

            assertRejected(() -> engine.approveJoin(CREATOR, ALICE), GroupPreconditionException.class,
                    ErrorCode.GROUP_NO_JOIN_REQUEST);
            assertRejected(() -> engine.rejectJoin(CREATOR, ALICE), GroupPreconditionException.class,
                    ErrorCode.GROUP_NO_JOIN_REQUEST);
        }

        @Test
        @DisplayName("Should drop a rejected request without admitting")
        void shouldDropRejectedRequest() {
            ChamaGroupEngine engine = engine(rules().approvalRequired(true).build());
            atStartOf(0);
            engine.join(ALICE);

            engine.rejectJoin(CREATOR, ALICE);

            assertThat(engine.hasPendingJoinRequest(ALICE)).isFalse();
            assertThat(engine.getMemberDetails(ALICE)).isEmpty();
            assertThat(events.ofType(ChamaEventType.JOIN_REJECTED)).hasSize(1);
        }

        @Test
        @DisplayName("Should keep the request pending when approval finds the group full")
        void shouldKeepRequestWhenFull() {
            ChamaGroupEngine engine = engine(rules().approvalRequired(true).maxMembers(3).build());
            atStartOf(0);
            joinAll(engine, ALICE, BOB, CAROL, DAVE);
            engine.approveJoin(CREATOR, ALICE);
            engine.approveJoin(CREATOR, BOB);
            engine.approveJoin(CREATOR, CAROL);

            assertRejected(() -> engine.approveJoin(CREATOR, DAVE), GroupCapacityException.class,
                    ErrorCode.GROUP_FULL);
            assertThat(engine.hasPendingJoinRequest(DAVE)).isTrue();
        }
    }

    @Nested
    @DisplayName("Leaving")
    class LeavingTests {

        @Test
        @DisplayName("Should refund everything a member paid in")
        void shouldRefundContributions() {
            // Arrange
            ChamaGroupEngine engine = engine();
            atStartOf(0);
            joinAll(engine, ALICE, BOB);
            contributeAll(engine, ALICE, BOB);

            // Act
            BigDecimal refund = engine.leave(ALICE);

            // Assert
            assertThat(refund).isEqualByComparingTo("1.0");
            assertThat(engine.getTotalFunds()).isEqualByComparingTo("1.0");
            assertThat(engine.getActiveMemberCount()).isEqualTo(1);
            assertThat(engine.getMemberCount()).isEqualTo(2);
            assertThat(engine.getMemberDetails(ALICE).orElseThrow().isActive()).isFalse();

            List<Transfer> outbound = gateway.outbound();
            assertThat(outbound).hasSize(1);
            assertThat(outbound.get(0).getParty()).isEqualTo(ALICE);
            assertThat(outbound.get(0).getAmount()).isEqualByComparingTo("1.0");
            assertThat(outbound.get(0).getReference()).isEqualTo(GROUP_ID + ":refund:" + ALICE);
            assertThat(events.ofType(ChamaEventType.MEMBER_LEFT).get(0).getAmount()).isEqualByComparingTo("1.0");
        }

        @Test
        @DisplayName("Should leave without a transfer when nothing was paid in")
        void shouldLeaveWithoutTransfer() {
            ChamaGroupEngine engine = engine();
            atStartOf(0);
            engine.join(ALICE);

            BigDecimal refund = engine.leave(ALICE);

            assertThat(refund).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(gateway.outbound()).isEmpty();
        }

        @Test
        @DisplayName("Should deduct one fine per missed period from the refund")
        void shouldDeductMissedFines() {
            ChamaGroupEngine engine = engine();
            atStartOf(0);
            engine.join(ALICE);
            contributeAll(engine, ALICE);
            atStartOf(2);
            contributeAll(engine, ALICE);

            BigDecimal refund = engine.leave(ALICE);

            // 2.0 paid in, one missed period at the default fine of 0.100
            assertThat(refund).isEqualByComparingTo("1.9");
        }

        @Test
        @DisplayName("Should refund nothing to a member who was already paid out")
        void shouldRefundNothingAfterPayout() {
            ChamaGroupEngine engine = engine();
            atStartOf(0);
            joinAll(engine, ALICE, BOB, CAROL);
            engine.setPayoutQueue(CREATOR, List.of(ALICE, BOB, CAROL));
            contributeAll(engine, ALICE, BOB, CAROL);
            engine.processRotationPayout(CREATOR);
            int transfersBefore = gateway.outbound().size();

            BigDecimal refund = engine.leave(ALICE);

            assertThat(refund).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(gateway.outbound()).hasSize(transfersBefore);
        }

        @Test
        @DisplayName("Should not let a punished member leave")
        void shouldRejectLeaveWhilePunished() {
            ChamaGroupEngine engine = engine();
            atStartOf(0);
            engine.join(ALICE);
            engine.punishMember(CREATOR, ALICE, PunishmentAction.WARNING, "late");

            assertRejected(() -> engine.leave(ALICE), GroupPreconditionException.class,
                    ErrorCode.GROUP_ACTIVE_PUNISHMENT);
        }

        @Test
        @DisplayName("Should reject leaving twice")
        void shouldRejectSecondLeave() {
            ChamaGroupEngine engine = engine();
            atStartOf(0);
            engine.join(ALICE);
            engine.leave(ALICE);

            assertRejected(() -> engine.leave(ALICE), ChamaAuthorizationException.class,
                    ErrorCode.GROUP_NOT_ACTIVE_MEMBER);
        }

        @Test
        @DisplayName("Should not let an admin ban and pardon a departed member back in")
        void shouldRejectPunishingDepartedMember() {
            ChamaGroupEngine engine = engine();
            atStartOf(0);
            joinAll(engine, ALICE, BOB);
            engine.leave(ALICE);

            assertRejected(() -> engine.punishMember(CREATOR, ALICE, PunishmentAction.BAN, "rejoin"),
                    GroupPreconditionException.class, ErrorCode.GROUP_MEMBER_INACTIVE);

            assertThat(engine.getPunishmentDetails(ALICE)).isEmpty();
            assertThat(engine.getMemberDetails(ALICE).orElseThrow().isActive()).isFalse();
            assertThat(engine.getActiveMemberCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should roll the member back in when the refund transfer fails")
        void shouldRollBackWhenRefundFails() {
            // Arrange
            ChamaGroupEngine engine = engine();
            atStartOf(0);
            joinAll(engine, ALICE, BOB);
            contributeAll(engine, ALICE, BOB);
            gateway.failOutbound(true);
            events.clear();

            // Act & Assert
            assertThatThrownBy(() -> engine.leave(ALICE)).isInstanceOf(ValueTransferException.class);

            assertThat(engine.getMemberDetails(ALICE).orElseThrow().isActive()).isTrue();
            assertThat(engine.getActiveMemberCount()).isEqualTo(2);
            assertThat(engine.getTotalFunds()).isEqualByComparingTo("2.0");
            assertThat(events.events()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Admins and creator")
    class AdminTests {

        @Test
        @DisplayName("Should let the creator add and remove admins")
        void shouldManageAdmins() {
            ChamaGroupEngine engine = engine();

            engine.addAdmin(CREATOR, ALICE);
            assertThat(engine.isAdmin(ALICE)).isTrue();

            engine.removeAdmin(CREATOR, ALICE);
            assertThat(engine.isAdmin(ALICE)).isFalse();
            assertThat(events.types()).containsExactly(ChamaEventType.ADMIN_ADDED, ChamaEventType.ADMIN_REMOVED);
        }

        @Test
        @DisplayName("Should not let a plain admin manage admins")
        void shouldRequireCreatorForAdminChanges() {
            ChamaGroupEngine engine = engine();
            engine.addAdmin(CREATOR, ALICE);

            assertRejected(() -> engine.addAdmin(ALICE, BOB), ChamaAuthorizationException.class,
                    ErrorCode.GROUP_NOT_CREATOR);
            assertRejected(() -> engine.removeAdmin(ALICE, CREATOR), ChamaAuthorizationException.class,
                    ErrorCode.GROUP_NOT_CREATOR);
        }

        @Test
        @DisplayName("Should never remove the creator's admin rights")
        void shouldNotRemoveCreator() {
            ChamaGroupEngine engine = engine();

            assertRejected(() -> engine.removeAdmin(CREATOR, CREATOR), GroupIntegrityException.class,
                    ErrorCode.GROUP_CANNOT_REMOVE_CREATOR);
            assertThat(engine.isAdmin(CREATOR)).isTrue();
        }

        @Test
        @DisplayName("Should hand the creator role over and keep the previous creator as admin")
        void shouldTransferCreator() {
            // Arrange
            ChamaGroupEngine engine = engine();

            // Act
            engine.transferCreator(CREATOR, BOB);

            // Assert
            assertThat(engine.getCreator()).isEqualTo(BOB);
            assertThat(engine.isAdmin(BOB)).isTrue();
            assertThat(engine.isAdmin(CREATOR)).isTrue();
            assertRejected(() -> engine.addAdmin(CREATOR, ALICE), ChamaAuthorizationException.class,
                    ErrorCode.GROUP_NOT_CREATOR);
            ChamaEvent transferred = events.ofType(ChamaEventType.CREATOR_TRANSFERRED).get(0);
            assertThat(transferred.getMember()).isEqualTo(BOB);
            assertThat(transferred.getCounterparty()).isEqualTo(CREATOR);
        }

        @Test
        @DisplayName("Should reject transferring the creator role to an invalid target")
        void shouldRejectInvalidCreatorTransfer() {
            ChamaGroupEngine engine = engine();

            assertRejected(() -> engine.transferCreator(CREATOR, CREATOR), GroupIntegrityException.class,
                    ErrorCode.GROUP_ALREADY_CREATOR);
            assertRejected(() -> engine.transferCreator(CREATOR, ""), GroupIntegrityException.class,
                    ErrorCode.GROUP_INVALID_ADDRESS);
            assertRejected(() -> engine.transferCreator(ALICE, BOB), ChamaAuthorizationException.class,
                    ErrorCode.GROUP_NOT_CREATOR);
        }
    }

    @Nested
    @DisplayName("Pausing")
    class PauseTests {

        @Test
        @DisplayName("Should block mutations while paused and keep queries available")
        void shouldBlockMutationsWhilePaused() {
            ChamaGroupEngine engine = engine();
            atStartOf(0);
            engine.join(ALICE);

            engine.pause(CREATOR);

            assertThat(engine.isPaused()).isTrue();
            assertRejected(() -> engine.join(BOB), GroupPreconditionException.class, ErrorCode.GROUP_PAUSED);
            assertRejected(() -> engine.contribute(ALICE, ContributionAsset.NATIVE, CONTRIBUTION),
                    GroupPreconditionException.class, ErrorCode.GROUP_PAUSED);
            assertRejected(() -> engine.pause(CREATOR), GroupPreconditionException.class, ErrorCode.GROUP_PAUSED);
            assertThat(engine.getMemberCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should resume after unpause")
        void shouldResumeAfterUnpause() {
            ChamaGroupEngine engine = engine();
            atStartOf(0);
            engine.pause(CREATOR);

            engine.unpause(CREATOR);
            engine.join(BOB);

            assertThat(engine.isPaused()).isFalse();
            assertThat(engine.getMemberCount()).isEqualTo(1);
            assertThat(events.types()).containsExactly(
                    ChamaEventType.GROUP_PAUSED, ChamaEventType.GROUP_UNPAUSED, ChamaEventType.MEMBER_JOINED);
        }

        @Test
        @DisplayName("Should reject unpausing a running group")
        void shouldRejectUnpauseWhenRunning() {
            ChamaGroupEngine engine = engine();

            assertRejected(() -> engine.unpause(CREATOR), GroupPreconditionException.class,
                    ErrorCode.GROUP_NOT_PAUSED);
        }

        @Test
        @DisplayName("Should only let admins pause")
        void shouldRequireAdminToPause() {
            ChamaGroupEngine engine = engine();

            assertRejected(() -> engine.pause(ALICE), ChamaAuthorizationException.class, ErrorCode.GROUP_NOT_ADMIN);
        }
    }

    @Nested
    @DisplayName("Event dispatch")
    class EventDispatchTests {

        @Test
        @DisplayName("Should not emit events for a rejected operation")
        void shouldNotEmitOnRejection() {
            ChamaGroupEngine engine = engine();

            assertThatThrownBy(() -> engine.join(ALICE)).isInstanceOf(GroupPreconditionException.class);

            assertThat(events.events()).isEmpty();
        }

        @Test
        @DisplayName("Should complete the operation when the listener fails")
        void shouldSurviveListenerFailure() {
            // Arrange
            GroupEventListener failing = event -> {
                throw new IllegalStateException("broker down");
            };
            ChamaGroupEngine engine = new ChamaGroupEngine(GROUP_ID, CREATOR, rules().build(),
                    EngineSettings.defaults(), clock, gateway, failing);
            atStartOf(0);

            // Act
            JoinOutcome outcome = engine.join(ALICE);

            // Assert
            assertThat(outcome).isEqualTo(JoinOutcome.ADMITTED);
            assertThat(engine.getMemberCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should release the group before handing events to the listener")
        void shouldDispatchOutsideLock() {
            // Arrange
            AtomicReference<ChamaGroupEngine> holder = new AtomicReference<>();
            List<Integer> seenByOtherThread = new ArrayList<>();
            GroupEventListener crossThreadReader = event -> {
                try {
                    seenByOtherThread.add(CompletableFuture.supplyAsync(() -> holder.get().getMemberCount())
                            .get(2, TimeUnit.SECONDS));
                } catch (Exception e) {
                    throw new IllegalStateException("group still locked during dispatch", e);
                }
            };
            ChamaGroupEngine engine = new ChamaGroupEngine(GROUP_ID, CREATOR, rules().build(),
                    EngineSettings.defaults(), clock, gateway, crossThreadReader);
            holder.set(engine);
            atStartOf(0);

            // Act
            engine.join(ALICE);

            // Assert
            assertThat(seenByOtherThread).containsExactly(1);
        }

        @Test
        @DisplayName("Should reject a call back into the group while value is moving")
        void shouldRejectReentrantCall() {
            // Arrange
            ChamaGroupEngine engine = engine();
            atStartOf(0);
            joinAll(engine, ALICE, BOB);
            RuntimeException[] nested = new RuntimeException[1];
            gateway.duringTransfer(transfer -> {
                try {
                    engine.leave(BOB);
                } catch (RuntimeException e) {
                    nested[0] = e;
                }
            });

            // Act
            engine.contribute(ALICE, ContributionAsset.NATIVE, CONTRIBUTION);

            // Assert
            assertThat(nested[0]).isInstanceOf(GroupPreconditionException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.GROUP_REENTRANT_CALL);
            assertThat(engine.getMemberDetails(BOB).orElseThrow().isActive()).isTrue();
            assertThat(engine.getTotalFunds()).isEqualByComparingTo("1.0");
        }
    }
}
