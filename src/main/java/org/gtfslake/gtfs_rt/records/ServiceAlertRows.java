package org.gtfslake.gtfs_rt.records;

import java.util.List;

/**
 * Snapshot of the three service alert tables, read together.
 *
 * @param alerts           alert rows, in table order
 * @param activePeriods    active period rows, joined to alerts by alert id
 * @param informedEntities informed entity rows, joined to alerts by alert id
 *
 * @since 1.0
 */
public record ServiceAlertRows(
        List<ServiceAlertRow> alerts,
        List<AlertActivePeriodRow> activePeriods,
        List<AlertInformedEntityRow> informedEntities) {}
