package at.sv.sihoa.inventory;

/**
 * @param upserted the number of created or updated records
 * @param retired  the number of records retired by this reconciliation
 */
public record ReconcileResult(int upserted, int retired) {
}
