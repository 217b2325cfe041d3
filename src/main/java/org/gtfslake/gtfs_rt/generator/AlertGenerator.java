package org.gtfslake.gtfs_rt.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.gtfslake.gtfs_rt.config.AppProperties;
import org.gtfslake.gtfs_rt.records.AlertActivePeriodRow;
import org.gtfslake.gtfs_rt.records.AlertInformedEntityRow;
import org.gtfslake.gtfs_rt.records.ServiceAlertRow;
import org.gtfslake.gtfs_rt.records.ServiceAlertRows;
import org.springframework.stereotype.Component;

import com.google.transit.realtime.GtfsRealtime;

/**
 * Generator component turning the lake's service alert tables into GTFS-Realtime alert entities.
 *
 * <p>Each alert row becomes exactly one feed entity whose id is the alert id. The entity carries:</p>
 * <ul>
 *   <li>Cause and effect, when stored</li>
 *   <li>Header and description text as a single translation in the configured language</li>
 *   <li>Every active period whose alert id matches, in table order</li>
 *   <li>Every informed entity whose alert id matches, in table order, with a nested
 *       trip descriptor when the row references a trip</li>
 * </ul>
 *
 * <p>Active periods and informed entities that reference no existing alert are dropped.</p>
 *
 * @since 1.0
 */
@Component
public class AlertGenerator {

    private final String language;

    /**
     * @param appProperties application settings providing the alert language
     */
    public AlertGenerator(AppProperties appProperties) {
        this.language = appProperties.getAlertLanguage();
    }

    /**
     * Creates a GTFS-Realtime TimeRange from an active period row.
     *
     * @param activePeriod the active period row
     * @return a TimeRange with start and end set when present
     */
    private GtfsRealtime.TimeRange createTimeRange(AlertActivePeriodRow activePeriod) {
        GtfsRealtime.TimeRange.Builder timeRange = GtfsRealtime.TimeRange.newBuilder();
        if (activePeriod.startTimestamp() != null) {
            timeRange.setStart(activePeriod.startTimestamp());
        }
        if (activePeriod.endTimestamp() != null) {
            timeRange.setEnd(activePeriod.endTimestamp());
        }
        return timeRange.build();
    }

    /**
     * Creates an informed entity selector from an informed entity row.
     *
     * @param informedEntity the informed entity row
     * @return the entity selector
     */
    private GtfsRealtime.EntitySelector createEntitySelector(AlertInformedEntityRow informedEntity) {
        GtfsRealtime.EntitySelector.Builder entitySelector = GtfsRealtime.EntitySelector.newBuilder();
        if (informedEntity.agencyId() != null) {
            entitySelector.setAgencyId(informedEntity.agencyId());
        }
        if (informedEntity.routeId() != null) {
            entitySelector.setRouteId(informedEntity.routeId());
        }
        if (informedEntity.routeType() != null) {
            entitySelector.setRouteType(informedEntity.routeType());
        }
        if (informedEntity.stopId() != null) {
            entitySelector.setStopId(informedEntity.stopId());
        }

        // no trip descriptor means no trip is informed
        DescriptorFactory.tripDescriptor(informedEntity.trip()).ifPresent(entitySelector::setTrip);

        return entitySelector.build();
    }

    /**
     * Wraps a text into a translated string with a single translation.
     *
     * @param text the text
     * @return the translated string
     */
    private GtfsRealtime.TranslatedString createTranslatedString(String text) {
        return GtfsRealtime.TranslatedString.newBuilder()
            .addTranslation(GtfsRealtime.TranslatedString.Translation.newBuilder()
                .setText(text)
                .setLanguage(language))
            .build();
    }

    /**
     * Populates an alert builder with the fields stored on the alert row itself.
     *
     * @param alertBuilder the alert builder to populate
     * @param serviceAlert the alert row
     */
    private void populateAlertBuilder(GtfsRealtime.Alert.Builder alertBuilder, ServiceAlertRow serviceAlert) {
        if (serviceAlert.cause() != null) {
            alertBuilder.setCause(ProtocolEnums.resolve(GtfsRealtime.Alert.Cause.class, "cause", serviceAlert.cause()));
        }
        if (serviceAlert.effect() != null) {
            alertBuilder.setEffect(ProtocolEnums.resolve(GtfsRealtime.Alert.Effect.class, "effect", serviceAlert.effect()));
        }
        if (serviceAlert.headerText() != null) {
            alertBuilder.setHeaderText(createTranslatedString(serviceAlert.headerText()));
        }
        if (serviceAlert.descriptionText() != null) {
            alertBuilder.setDescriptionText(createTranslatedString(serviceAlert.descriptionText()));
        }
    }

    /**
     * Generates the alert entities of a service alert snapshot.
     *
     * @param rows the alert, active period and informed entity row-sets
     * @return one entity per alert row, in alert row order
     * @throws org.gtfslake.gtfs_rt.exceptions.FeedSchemaException if a row cannot be expressed in GTFS-RT
     */
    public List<GtfsRealtime.FeedEntity> generateAlerts(ServiceAlertRows rows) {
        Map<String, List<AlertActivePeriodRow>> activePeriods =
            FeedEntities.groupByParent(rows.activePeriods(), AlertActivePeriodRow::serviceAlertId);
        Map<String, List<AlertInformedEntityRow>> informedEntities =
            FeedEntities.groupByParent(rows.informedEntities(), AlertInformedEntityRow::serviceAlertId);

        List<GtfsRealtime.FeedEntity> entities = new ArrayList<>(rows.alerts().size());
        for (ServiceAlertRow serviceAlert : rows.alerts()) {
            GtfsRealtime.FeedEntity.Builder entity = GtfsRealtime.FeedEntity.newBuilder();
            if (serviceAlert.serviceAlertId() != null) {
                entity.setId(serviceAlert.serviceAlertId());
            }

            GtfsRealtime.Alert.Builder alertBuilder = entity.getAlertBuilder();
            populateAlertBuilder(alertBuilder, serviceAlert);

            for (AlertActivePeriodRow activePeriod : FeedEntities.childrenOf(activePeriods, serviceAlert.serviceAlertId())) {
                alertBuilder.addActivePeriod(createTimeRange(activePeriod));
            }
            for (AlertInformedEntityRow informedEntity : FeedEntities.childrenOf(informedEntities, serviceAlert.serviceAlertId())) {
                alertBuilder.addInformedEntity(createEntitySelector(informedEntity));
            }

            entities.add(FeedEntities.build(entity));
        }
        return entities;
    }
}
