package com.tether.cleanup;

import com.tether.host.HostApplication;
import com.tether.host.HostDocument;
import com.tether.host.HostTransaction;
import com.tether.model.ViewModel;
import com.tether.scheduler.IdleContext;
import com.tether.scheduler.IdleTaskScheduler;
import com.tether.scheduler.ScheduledTask;
import com.tether.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Deletes a session's marker element once, inside a host transaction, on the
 * idle context.
 * 
 * The marker id is claimed when the deletion is scheduled, so scheduling twice
 * before the first task runs deletes only once. A deletion that fails leaves
 * the marker abandoned: it is not handed back for another attempt. The same
 * holds when no document is active by the time the deletion runs.
 */
public class TransactionalResourceCleaner {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionalResourceCleaner.class);
    
    static final String TRANSACTION_NAME = "Tether: remove visualization marker";
    
    private final IdleTaskScheduler scheduler;
    private final HostApplication application;
    private final List<MarkerId> abandonedMarkers = new ArrayList<>();
    
    public TransactionalResourceCleaner(IdleTaskScheduler scheduler, HostApplication application) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.application = Objects.requireNonNull(application, "application");
    }
    
    /**
     * Claims the session's marker and queues its deletion for the next idle tick.
     * 
     * @param session the session owning the marker
     * @return true if a deletion was queued, false if there was nothing to delete
     */
    public boolean scheduleMarkerDeletion(Session session) {
        ViewModel viewModel = session.viewModel();
        if (viewModel == null) {
            LOGGER.debug("{} has no view model, no marker to delete", session);
            return false;
        }
        
        MarkerId claimed = viewModel.visualization().claimMarker();
        if (!claimed.isValid()) {
            LOGGER.debug("No live marker for {}, deletion not scheduled", session);
            return false;
        }
        
        scheduler.scheduleForExecution(ScheduledTask.of(
            "delete-marker-" + claimed.value(), () -> deleteMarkerOnce(claimed)));
        LOGGER.debug("Queued deletion of {} for {}", claimed, session);
        return true;
    }
    
    /**
     * Deletes the marker inside a transaction on the active document.
     * Must run on the idle context.
     * 
     * @param markerId the claimed marker
     * @throws ResourceCleanupException if the transaction or the deletion fails
     */
    void deleteMarkerOnce(MarkerId markerId) {
        IdleContext.requireIdleContext("deleteMarkerOnce");
        
        if (!markerId.isValid()) {
            return;
        }
        
        Optional<HostDocument> document = application.activeDocument();
        if (document.isEmpty()) {
            // The claim cannot be handed back, so the marker stays in whichever document holds it
            abandon(markerId);
            return;
        }
        
        HostTransaction transaction;
        try {
            transaction = document.get().startTransaction(TRANSACTION_NAME);
        } catch (RuntimeException e) {
            abandon(markerId);
            throw new ResourceCleanupException(
                String.format("Could not open a transaction on document '%s' to delete %s",
                    document.get().id(), markerId), e);
        }
        
        try {
            document.get().delete(markerId);
            transaction.commit();
            LOGGER.info("Deleted {} from document '{}'", markerId, document.get().id());
        } catch (RuntimeException e) {
            rollbackQuietly(transaction, markerId);
            abandon(markerId);
            throw new ResourceCleanupException(
                String.format("Failed to delete %s from document '%s'", markerId, document.get().id()), e);
        } finally {
            if (transaction.isOpen()) {
                transaction.close();
            }
        }
    }
    
    private void rollbackQuietly(HostTransaction transaction, MarkerId markerId) {
        try {
            if (transaction.isOpen()) {
                transaction.rollback();
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Rollback after failed deletion of {} also failed", markerId, e);
        }
    }
    
    private void abandon(MarkerId markerId) {
        abandonedMarkers.add(markerId);
        LOGGER.warn("Marker {} abandoned after failed cleanup", markerId);
    }
    
    /**
     * Markers whose deletion failed or found no active document. They stay in
     * the document.
     */
    public List<MarkerId> getAbandonedMarkers() {
        return Collections.unmodifiableList(abandonedMarkers);
    }
}
