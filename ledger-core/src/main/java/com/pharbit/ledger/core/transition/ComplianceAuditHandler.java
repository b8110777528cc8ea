package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.contract.AddComplianceCheck;
import com.pharbit.ledger.core.contract.CommandType;
import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.contract.GrantApproval;
import com.pharbit.ledger.core.contract.RecordAuditTrail;
import com.pharbit.ledger.core.contract.RevokeApproval;
import com.pharbit.ledger.core.contract.UpdateComplianceStatus;
import com.pharbit.ledger.core.event.EventDraft;
import com.pharbit.ledger.core.model.ApprovalId;
import com.pharbit.ledger.core.model.AuditEntry;
import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.ComplianceRecord;
import com.pharbit.ledger.core.model.ComplianceRecordId;
import com.pharbit.ledger.core.model.ComplianceStatus;
import com.pharbit.ledger.core.model.RegulatoryApproval;
import com.pharbit.ledger.core.outcome.ErrorKind;
import com.pharbit.ledger.core.spi.LedgerView;
import com.pharbit.ledger.core.spi.StateChange;

import java.time.Instant;
import java.util.List;

/**
 * Compliance &amp; Audit Engine 명령 처리.
 *
 * <p>규정 준수 기록과 감사 기록은 서로 독립된 로그입니다. 감사 기록 추가는 규정 준수 기록을 건드리지 않습니다.</p>
 */
final class ComplianceAuditHandler {

    Transition<ComplianceRecord> addCheck(LedgerView view, Envelope<?> envelope, AddComplianceCheck command) {
        Guards.authorize(Permissions.canAddComplianceCheck(view.rolesOf(envelope.caller())), envelope);
        Batch batch = Guards.batch(view, command.batchId());
        String checkType = Guards.text(command.checkType(), "checkType");

        Instant now = envelope.issuedAt();
        ComplianceRecordId id = ComplianceRecordId.of(batch.id(), view.complianceRecords(batch.id()).size() + 1);
        ComplianceRecord record = new ComplianceRecord(id, checkType, ComplianceStatus.PENDING, false,
            envelope.caller(), command.notes(), command.findings(), command.correctiveActions(), command.evidence(),
            now, envelope.caller(), now);

        EventDraft event = EventDraft.builder(CommandType.ADD_COMPLIANCE_CHECK, id.toString())
            .with("checkType", checkType)
            .with("status", record.status())
            .with("evidenceCount", record.evidence().size())
            .build();
        return Transition.accepted(record, List.of(new StateChange.PutComplianceRecord(record)), event);
    }

    Transition<ComplianceRecord> updateStatus(LedgerView view, Envelope<?> envelope, UpdateComplianceStatus command) {
        Guards.authorize(Permissions.canUpdateCompliance(view.rolesOf(envelope.caller())), envelope);
        ComplianceRecord current = LedgerProjections.findComplianceRecord(view, command.recordId())
            .orElseThrow(() -> new CommandRejection(ErrorKind.NOT_FOUND,
                "Compliance record not found: " + command.recordId()));

        ComplianceRecord updated = current.withStatus(command.newStatus(), command.passed(), command.updatedNotes(),
            envelope.caller(), envelope.issuedAt());
        EventDraft event = EventDraft.builder(CommandType.UPDATE_COMPLIANCE_STATUS, command.recordId().toString())
            .with("from", current.status())
            .with("to", updated.status())
            .with("passed", updated.passed())
            .build();
        return Transition.accepted(updated, List.of(new StateChange.PutComplianceRecord(updated)), event);
    }

    Transition<AuditEntry> recordAudit(LedgerView view, Envelope<?> envelope, RecordAuditTrail command) {
        Guards.authorize(Permissions.canRecordAudit(view.rolesOf(envelope.caller())), envelope);
        Batch batch = Guards.batch(view, command.batchId());
        String auditType = Guards.text(command.auditType(), "auditType");

        AuditEntry entry = new AuditEntry(batch.id(), view.auditEntries(batch.id()).size() + 1, envelope.caller(),
            auditType, command.findings(), command.recommendations(), command.result(), command.evidence(),
            envelope.issuedAt());
        EventDraft event = EventDraft.builder(CommandType.RECORD_AUDIT_TRAIL, batch.id().getValue())
            .with("sequence", entry.sequence())
            .with("auditType", auditType)
            .with("result", entry.result())
            .build();
        return Transition.accepted(entry, List.of(new StateChange.AppendAuditEntry(entry)), event);
    }

    Transition<RegulatoryApproval> grantApproval(LedgerView view, Envelope<?> envelope, GrantApproval command) {
        Guards.authorize(Permissions.canManageApprovals(view.rolesOf(envelope.caller())), envelope);
        String drugCode = Guards.text(command.drugCode(), "drugCode");
        String approvalNumber = Guards.text(command.approvalNumber(), "approvalNumber");
        Guards.require(command.expiryDate().isAfter(command.approvalDate()), ErrorKind.BAD_INPUT,
            "expiryDate must be after approvalDate (expiry: " + command.expiryDate() + ")");
        boolean duplicate = view.approvals().stream()
            .anyMatch(a -> !a.revoked() && a.approvalNumber().equals(approvalNumber));
        Guards.require(!duplicate, ErrorKind.ALREADY_EXISTS, "Approval number already in use: " + approvalNumber);

        ApprovalId id = ApprovalId.of(view.approvals().size() + 1L);
        RegulatoryApproval approval = new RegulatoryApproval(id, drugCode, approvalNumber, command.regulatoryBody(),
            command.approvalDate(), command.expiryDate(), command.conditions(), envelope.caller(), false, null);
        EventDraft event = EventDraft.builder(CommandType.GRANT_APPROVAL, String.valueOf(id.getValue()))
            .with("drugCode", drugCode)
            .with("approvalNumber", approvalNumber)
            .with("approvalDate", approval.approvalDate())
            .with("expiryDate", approval.expiryDate())
            .build();
        return Transition.accepted(approval, List.of(new StateChange.PutApproval(approval)), event);
    }

    Transition<RegulatoryApproval> revokeApproval(LedgerView view, Envelope<?> envelope, RevokeApproval command) {
        Guards.authorize(Permissions.canManageApprovals(view.rolesOf(envelope.caller())), envelope);
        RegulatoryApproval current = view.approval(command.approvalId())
            .orElseThrow(() -> new CommandRejection(ErrorKind.NOT_FOUND,
                "Approval not found: " + command.approvalId().getValue()));
        Guards.require(!current.revoked(), ErrorKind.BAD_INPUT,
            "Approval already revoked: " + command.approvalId().getValue());

        RegulatoryApproval revoked = current.revoke(command.reason());
        EventDraft event = EventDraft.builder(CommandType.REVOKE_APPROVAL,
                String.valueOf(command.approvalId().getValue()))
            .with("drugCode", current.drugCode())
            .with("reason", revoked.revocationReason())
            .build();
        return Transition.accepted(revoked, List.of(new StateChange.PutApproval(revoked)), event);
    }
}
