package com.pharbit.ledger.adapter.runner;

import com.pharbit.ledger.core.contract.AddComplianceCheck;
import com.pharbit.ledger.core.contract.AddOwner;
import com.pharbit.ledger.core.contract.BindSensor;
import com.pharbit.ledger.core.contract.Command;
import com.pharbit.ledger.core.contract.CreateBatch;
import com.pharbit.ledger.core.contract.CreateProposal;
import com.pharbit.ledger.core.contract.DestroyBatch;
import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.contract.ExecuteProposal;
import com.pharbit.ledger.core.contract.GrantApproval;
import com.pharbit.ledger.core.contract.GrantRole;
import com.pharbit.ledger.core.contract.RecordAuditTrail;
import com.pharbit.ledger.core.contract.RecordTelemetry;
import com.pharbit.ledger.core.contract.RegisterStakeholder;
import com.pharbit.ledger.core.contract.RemoveOwner;
import com.pharbit.ledger.core.contract.RevokeApproval;
import com.pharbit.ledger.core.contract.RevokeRole;
import com.pharbit.ledger.core.contract.SetActive;
import com.pharbit.ledger.core.contract.SetBatchBounds;
import com.pharbit.ledger.core.contract.SetKyc;
import com.pharbit.ledger.core.contract.SetQuorum;
import com.pharbit.ledger.core.contract.SetTelemetryBounds;
import com.pharbit.ledger.core.contract.TransferCustody;
import com.pharbit.ledger.core.contract.UpdateComplianceStatus;
import com.pharbit.ledger.core.contract.UpdateStatus;
import com.pharbit.ledger.core.contract.Vote;
import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.GrantRoleAction;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.ProposalAction;
import com.pharbit.ledger.core.model.ProposalId;
import com.pharbit.ledger.core.model.RevokeRoleAction;
import com.pharbit.ledger.core.model.UpdateBoundsAction;
import com.pharbit.ledger.core.spi.LedgerView;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 명령별 엔티티 잠금 키 계산.
 *
 * <p>키는 명령이 쓰는 엔티티(EXCLUSIVE)와, 같은 명령 안에서 판정에 읽는 역할/조직 기록,
 * 텔레메트리 기본 범위, Owner 집합과 정족수(SHARED)를 포함합니다. 호출자의 역할 키는 항상 SHARED로
 * 포함됩니다. 같은 배치를 대상으로 하는 두 보관자 이전은 같은 키를 EXCLUSIVE로 잡으므로 순서대로
 * 처리되고, 쓰는 엔티티가 겹치지 않는 명령은 병렬로 처리됩니다.</p>
 *
 * <p><strong>키 형식:</strong></p>
 * <ul>
 *   <li>role:{identity}, stakeholder:{identity}</li>
 *   <li>batch:{id}, telemetry:{id}, compliance:{id}, audit:{id}</li>
 *   <li>bounds, approvals, governance</li>
 *   <li>proposal:{id}</li>
 * </ul>
 *
 * <p>투표와 실행은 governance 키를 SHARED로 잡습니다. 정족수 변경이나 Owner 변경이 판정과 커밋
 * 사이에 끼어들면 이벤트 순서와 판정에 쓰인 상태가 어긋나기 때문입니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
final class CommandLocks {

    private static final String BOUNDS = "bounds";
    private static final String GOVERNANCE = "governance";

    private CommandLocks() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static Map<String, LockMode> keysFor(LedgerView view, Envelope<?> envelope) {
        Map<String, LockMode> keys = new LinkedHashMap<>();
        read(keys, role(envelope.caller()));
        Command<?> command = envelope.command();

        if (command instanceof GrantRole c) {
            write(keys, role(c.identity()));
        } else if (command instanceof RevokeRole c) {
            write(keys, role(c.identity()));
        } else if (command instanceof RegisterStakeholder c) {
            write(keys, stakeholder(c.identity()));
            write(keys, role(c.identity()));
        } else if (command instanceof SetKyc c) {
            write(keys, stakeholder(c.identity()));
        } else if (command instanceof SetActive c) {
            write(keys, stakeholder(c.identity()));
        } else if (command instanceof CreateBatch c) {
            write(keys, batch(c.batchId()));
            read(keys, role(c.producer()));
            read(keys, stakeholder(c.custodian()));
            read(keys, role(c.custodian()));
        } else if (command instanceof UpdateStatus c) {
            write(keys, batch(c.batchId()));
        } else if (command instanceof DestroyBatch c) {
            write(keys, batch(c.batchId()));
        } else if (command instanceof TransferCustody c) {
            write(keys, batch(c.batchId()));
            read(keys, stakeholder(c.newCustodian()));
            read(keys, role(c.newCustodian()));
        } else if (command instanceof SetTelemetryBounds) {
            write(keys, BOUNDS);
        } else if (command instanceof SetBatchBounds c) {
            write(keys, telemetry(c.batchId()));
        } else if (command instanceof BindSensor c) {
            write(keys, telemetry(c.batchId()));
            read(keys, role(c.device()));
        } else if (command instanceof RecordTelemetry c) {
            write(keys, telemetry(c.batchId()));
            read(keys, BOUNDS);
        } else if (command instanceof AddComplianceCheck c) {
            write(keys, "compliance:" + c.batchId().getValue());
        } else if (command instanceof UpdateComplianceStatus c) {
            write(keys, "compliance:" + c.recordId().batchId().getValue());
        } else if (command instanceof RecordAuditTrail c) {
            write(keys, "audit:" + c.batchId().getValue());
        } else if (command instanceof GrantApproval || command instanceof RevokeApproval) {
            write(keys, "approvals");
        } else if (command instanceof AddOwner c) {
            write(keys, GOVERNANCE);
            write(keys, role(c.owner()));
        } else if (command instanceof RemoveOwner c) {
            write(keys, GOVERNANCE);
            write(keys, role(c.owner()));
        } else if (command instanceof SetQuorum || command instanceof CreateProposal) {
            write(keys, GOVERNANCE);
        } else if (command instanceof Vote c) {
            write(keys, proposal(c.proposalId()));
            read(keys, GOVERNANCE);
        } else if (command instanceof ExecuteProposal c) {
            write(keys, proposal(c.proposalId()));
            read(keys, GOVERNANCE);
            // 제안의 action은 생성 후 바뀌지 않으므로 잠금 전에 읽어도 안전
            view.proposal(c.proposalId()).ifPresent(p -> actionKeys(p.action()).forEach(key -> write(keys, key)));
        }
        return keys;
    }

    private static void read(Map<String, LockMode> keys, String key) {
        keys.merge(key, LockMode.SHARED, LockMode::merge);
    }

    private static void write(Map<String, LockMode> keys, String key) {
        keys.merge(key, LockMode.EXCLUSIVE, LockMode::merge);
    }

    private static Set<String> actionKeys(ProposalAction action) {
        if (action instanceof GrantRoleAction grant) {
            return Set.of(role(grant.grantee()));
        }
        if (action instanceof RevokeRoleAction revoke) {
            return Set.of(role(revoke.holder()));
        }
        if (action instanceof UpdateBoundsAction) {
            return Set.of(BOUNDS);
        }
        return Set.of();
    }

    private static String role(Identity identity) {
        return "role:" + identity.getValue();
    }

    private static String stakeholder(Identity identity) {
        return "stakeholder:" + identity.getValue();
    }

    private static String batch(BatchId batchId) {
        return "batch:" + batchId.getValue();
    }

    private static String telemetry(BatchId batchId) {
        return "telemetry:" + batchId.getValue();
    }

    private static String proposal(ProposalId proposalId) {
        return "proposal:" + proposalId.getValue();
    }
}
