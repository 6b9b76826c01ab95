package com.chamapool.chama.engine;

import com.chamapool.chama.domain.Proposal;
import com.chamapool.chama.domain.ProposalType;
import com.chamapool.chama.domain.PunishmentAction;
import com.chamapool.chama.exception.ChamaAuthorizationException;
import com.chamapool.chama.exception.GroupIntegrityException;
import com.chamapool.chama.exception.GroupPreconditionException;
import com.chamapool.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChamaGroupEngine Governance Tests")
class ChamaGroupEngineGovernanceTest extends AbstractGroupEngineTest {

    private static final Duration VOTING = Duration.ofDays(3);

    private ChamaGroupEngine engine;

    @BeforeEach
    void setUp() {
        engine = engine();
        atStartOf(0);
        joinAll(engine, ALICE, BOB, CAROL, DAVE, ERIN);
    }

    private long propose(ProposalType type, String target) {
        return engine.createProposal(ALICE, type, target, null, "Motion on " + target);
    }

    private void vote(long id, boolean support, String... voters) {
        for (String voter : voters) {
            engine.voteOnProposal(voter, id, support);
        }
    }

    private void closeVoting() {
        clock.advance(VOTING.plusSeconds(1));
    }

    @Test
    @DisplayName("Should round the quorum up to whole votes")
    void shouldComputeRequiredVotes() {
        assertThat(ChamaGroupEngine.requiredVotes(0, 50)).isZero();
        assertThat(ChamaGroupEngine.requiredVotes(1, 50)).isEqualTo(1);
        assertThat(ChamaGroupEngine.requiredVotes(4, 50)).isEqualTo(2);
        assertThat(ChamaGroupEngine.requiredVotes(5, 50)).isEqualTo(3);
        assertThat(ChamaGroupEngine.requiredVotes(3, 67)).isEqualTo(3);
    }

    @Nested
    @DisplayName("Proposals")
    class ProposalTests {

        @Test
        @DisplayName("Should number proposals from one and open a voting window")
        void shouldCreateProposals() {
            // Arrange
            Instant now = clock.instant();

            // Act
            long first = propose(ProposalType.ADD_ADMIN, BOB);
            long second = propose(ProposalType.KICK_MEMBER, CAROL);

            // Assert
            assertThat(first).isEqualTo(1);
            assertThat(second).isEqualTo(2);
            Proposal proposal = engine.getProposal(first).orElseThrow();
            assertThat(proposal.getProposer()).isEqualTo(ALICE);
            assertThat(proposal.getTarget()).isEqualTo(BOB);
            assertThat(proposal.getCreatedAt()).isEqualTo(now);
            assertThat(proposal.getVotingEndsAt()).isEqualTo(now.plus(VOTING));
            assertThat(proposal.isExecuted()).isFalse();
            assertThat(engine.getProposals()).hasSize(2);
            assertThat(events.ofType(ChamaEventType.PROPOSAL_CREATED)).hasSize(2);
        }

        @Test
        @DisplayName("Should only let active members propose a valid target")
        void shouldValidateProposer() {
            assertRejected(() -> engine.createProposal(CREATOR, ProposalType.ADD_ADMIN, BOB, null, "x"),
                    ChamaAuthorizationException.class, ErrorCode.GROUP_NOT_ACTIVE_MEMBER);
            assertRejected(() -> engine.createProposal(ALICE, ProposalType.ADD_ADMIN, " ", null, "x"),
                    GroupIntegrityException.class, ErrorCode.GROUP_INVALID_ADDRESS);
            assertThat(engine.getProposals()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Voting")
    class VotingTests {

        @Test
        @DisplayName("Should tally votes and remember who voted")
        void shouldTallyVotes() {
            long id = propose(ProposalType.ADD_ADMIN, BOB);

            vote(id, true, ALICE, BOB);
            vote(id, false, CAROL);

            Proposal proposal = engine.getProposal(id).orElseThrow();
            assertThat(proposal.getVotesFor()).isEqualTo(2);
            assertThat(proposal.getVotesAgainst()).isEqualTo(1);
            assertThat(engine.hasVoted(id, CAROL)).isTrue();
            assertThat(engine.hasVoted(id, DAVE)).isFalse();
            assertThat(events.ofType(ChamaEventType.VOTE_CAST).get(2).getSupport()).isFalse();
        }

        @Test
        @DisplayName("Should reject a second vote from the same member")
        void shouldRejectDoubleVote() {
            long id = propose(ProposalType.ADD_ADMIN, BOB);
            vote(id, true, ALICE);

            assertRejected(() -> engine.voteOnProposal(ALICE, id, false), GroupPreconditionException.class,
                    ErrorCode.GROUP_ALREADY_VOTED);
            assertThat(engine.getProposal(id).orElseThrow().getVotesAgainst()).isZero();
        }

        @Test
        @DisplayName("Should accept votes until the window end and reject them afterwards")
        void shouldCloseVotingAfterWindow() {
            long id = propose(ProposalType.ADD_ADMIN, BOB);
            clock.advance(VOTING);
            vote(id, true, ALICE);

            clock.advance(Duration.ofSeconds(1));

            assertRejected(() -> engine.voteOnProposal(BOB, id, true), GroupPreconditionException.class,
                    ErrorCode.GROUP_VOTING_CLOSED);
        }

        @Test
        @DisplayName("Should reject votes from outsiders and on unknown proposals")
        void shouldRejectInvalidVotes() {
            long id = propose(ProposalType.ADD_ADMIN, BOB);

            assertRejected(() -> engine.voteOnProposal(OUTSIDER, id, true), ChamaAuthorizationException.class,
                    ErrorCode.GROUP_NOT_ACTIVE_MEMBER);
            assertRejected(() -> engine.voteOnProposal(ALICE, 99, true), GroupIntegrityException.class,
                    ErrorCode.GROUP_PROPOSAL_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("Should not execute while voting is still open")
        void shouldRejectEarlyExecution() {
            long id = propose(ProposalType.ADD_ADMIN, BOB);
            vote(id, true, ALICE, BOB, CAROL);

            assertRejected(() -> engine.executeProposal(CREATOR, id), GroupPreconditionException.class,
                    ErrorCode.GROUP_VOTING_ACTIVE);
            clock.advance(VOTING);
            assertRejected(() -> engine.executeProposal(CREATOR, id), GroupPreconditionException.class,
                    ErrorCode.GROUP_VOTING_ACTIVE);
        }

        @Test
        @DisplayName("Should require a quorum of active members")
        void shouldRequireQuorum() {
            long id = propose(ProposalType.ADD_ADMIN, BOB);
            vote(id, true, ALICE, BOB);
            closeVoting();

            assertRejected(() -> engine.executeProposal(CREATOR, id), GroupPreconditionException.class,
                    ErrorCode.GROUP_INSUFFICIENT_PARTICIPATION);
            assertThat(engine.getProposal(id).orElseThrow().isExecuted()).isFalse();
        }

        @Test
        @DisplayName("Should reject a proposal without a majority in favour")
        void shouldRejectTie() {
            long id = propose(ProposalType.ADD_ADMIN, BOB);
            vote(id, true, ALICE, BOB);
            vote(id, false, CAROL, DAVE);
            closeVoting();

            assertRejected(() -> engine.executeProposal(CREATOR, id), GroupPreconditionException.class,
                    ErrorCode.GROUP_PROPOSAL_REJECTED);
        }

        @Test
        @DisplayName("Should only let admins execute")
        void shouldRequireAdmin() {
            long id = propose(ProposalType.ADD_ADMIN, BOB);
            vote(id, true, ALICE, BOB, CAROL);
            closeVoting();

            assertRejected(() -> engine.executeProposal(ALICE, id), ChamaAuthorizationException.class,
                    ErrorCode.GROUP_NOT_ADMIN);
        }

        @Test
        @DisplayName("Should add an admin and mark the proposal executed exactly once")
        void shouldExecuteAddAdmin() {
            // Arrange
            long id = propose(ProposalType.ADD_ADMIN, BOB);
            vote(id, true, ALICE, BOB, CAROL);
            closeVoting();

            // Act
            engine.executeProposal(CREATOR, id);

            // Assert
            Proposal proposal = engine.getProposal(id).orElseThrow();
            assertThat(proposal.isExecuted()).isTrue();
            assertThat(proposal.getExecutedAt()).isEqualTo(clock.instant());
            assertThat(engine.isAdmin(BOB)).isTrue();
            assertThat(events.ofType(ChamaEventType.PROPOSAL_EXECUTED)).hasSize(1);
            assertRejected(() -> engine.executeProposal(CREATOR, id), GroupIntegrityException.class,
                    ErrorCode.GROUP_PROPOSAL_EXECUTED);
            assertRejected(() -> engine.voteOnProposal(DAVE, id, true), GroupIntegrityException.class,
                    ErrorCode.GROUP_PROPOSAL_EXECUTED);
        }

        @Test
        @DisplayName("Should remove an admin but never the creator")
        void shouldExecuteRemoveAdmin() {
            engine.addAdmin(CREATOR, BOB);
            long removeBob = propose(ProposalType.REMOVE_ADMIN, BOB);
            long removeCreator = propose(ProposalType.REMOVE_ADMIN, CREATOR);
            vote(removeBob, true, ALICE, BOB, CAROL);
            vote(removeCreator, true, ALICE, BOB, CAROL);
            closeVoting();

            engine.executeProposal(CREATOR, removeBob);

            assertThat(engine.isAdmin(BOB)).isFalse();
            assertRejected(() -> engine.executeProposal(CREATOR, removeCreator), GroupIntegrityException.class,
                    ErrorCode.GROUP_CANNOT_REMOVE_CREATOR);
            assertThat(engine.getProposal(removeCreator).orElseThrow().isExecuted()).isFalse();
            assertThat(engine.isAdmin(CREATOR)).isTrue();
        }

        @Test
        @DisplayName("Should deactivate a kicked member")
        void shouldExecuteKick() {
            long id = propose(ProposalType.KICK_MEMBER, ERIN);
            vote(id, true, ALICE, BOB, CAROL);
            closeVoting();

            engine.executeProposal(CREATOR, id);

            assertThat(engine.getMemberDetails(ERIN).orElseThrow().isActive()).isFalse();
            assertThat(engine.getActiveMemberCount()).isEqualTo(4);
            ChamaEvent left = events.ofType(ChamaEventType.MEMBER_LEFT).get(0);
            assertThat(left.getMember()).isEqualTo(ERIN);
            assertThat(left.getReason()).isEqualTo("Kicked by proposal " + id);
        }

        @Test
        @DisplayName("Should keep a kicked member out of reach of admin punishments")
        void shouldNotReviveKickedMemberThroughPunishment() {
            // Arrange
            long id = propose(ProposalType.KICK_MEMBER, CAROL);
            vote(id, true, ALICE, BOB, DAVE);
            closeVoting();
            engine.executeProposal(CREATOR, id);

            // Act & Assert
            assertRejected(() -> engine.punishMember(CREATOR, CAROL, PunishmentAction.BAN, "again"),
                    GroupPreconditionException.class, ErrorCode.GROUP_MEMBER_INACTIVE);
            assertRejected(() -> engine.cancelPunishment(CREATOR, CAROL), GroupPreconditionException.class,
                    ErrorCode.GROUP_NO_ACTIVE_PUNISHMENT);
            assertThat(engine.getMemberDetails(CAROL).orElseThrow().isActive()).isFalse();
            assertThat(engine.getActiveMemberCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should not reinstate a banned member who was kicked afterwards")
        void shouldKeepKickWhenBanIsCancelled() {
            // Arrange
            engine.punishMember(CREATOR, ERIN, PunishmentAction.BAN, "fraud");
            long id = propose(ProposalType.KICK_MEMBER, ERIN);
            vote(id, true, ALICE, BOB);
            closeVoting();
            engine.executeProposal(CREATOR, id);

            // Act
            engine.cancelPunishment(CREATOR, ERIN);

            // Assert
            assertThat(engine.getPunishmentDetails(ERIN).orElseThrow().isActive()).isFalse();
            assertThat(engine.getMemberDetails(ERIN).orElseThrow().isActive()).isFalse();
            assertThat(engine.getActiveMemberCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should reinstate a banned member through a cancel proposal")
        void shouldExecuteCancelPunishment() {
            engine.punishMember(CREATOR, ERIN, PunishmentAction.BAN, "fraud");
            long id = propose(ProposalType.CANCEL_PUNISHMENT, ERIN);
            vote(id, true, ALICE, BOB);
            closeVoting();

            engine.executeProposal(CREATOR, id);

            assertThat(engine.getMemberDetails(ERIN).orElseThrow().isActive()).isTrue();
            assertThat(engine.getPunishmentDetails(ERIN).orElseThrow().isActive()).isFalse();
            assertThat(engine.getActiveMemberCount()).isEqualTo(5);
        }
    }
}
