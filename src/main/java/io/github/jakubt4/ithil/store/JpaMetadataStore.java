package io.github.jakubt4.ithil.store;

import io.github.jakubt4.ithil.error.StoreUnavailableException;
import io.github.jakubt4.ithil.model.Image;
import io.github.jakubt4.ithil.model.Telescope;
import io.github.jakubt4.ithil.selection.FieldPredicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.List;

/**
 * {@link MetadataStore} backed by Spring Data JPA.
 *
 * <p>Each query runs in its own read-only transaction, so the pooled connection
 * is held only for the duration of that query. Persistence and transaction
 * failures surface as {@link StoreUnavailableException}.
 */
@Slf4j
@Service
public class JpaMetadataStore implements MetadataStore {

    private final TelescopeRepository telescopeRepository;
    private final ImageRepository imageRepository;
    private final TransactionTemplate readOnly;

    public JpaMetadataStore(final TelescopeRepository telescopeRepository,
                            final ImageRepository imageRepository,
                            final PlatformTransactionManager transactionManager) {
        this.telescopeRepository = telescopeRepository;
        this.imageRepository = imageRepository;
        this.readOnly = new TransactionTemplate(transactionManager);
        this.readOnly.setReadOnly(true);
    }

    @Override
    public List<Telescope> queryTelescopes(final FieldPredicate<Telescope> predicate) {
        final var telescopes = query("telescope query", status ->
                telescopeRepository.findAll(Specifications.<TelescopeEntity, Telescope>matching(predicate),
                                Sort.by("telescopeId"))
                        .stream()
                        .map(TelescopeEntity::toTelescope)
                        .toList());
        log.debug("Telescope query [{}] matched {} telescope(s)", predicate, telescopes.size());
        return telescopes;
    }

    @Override
    public TelescopeInventory queryDistinctTelescopeFields() {
        return query("telescope discovery", status -> new TelescopeInventory(
                telescopeRepository.findDistinctSites(),
                telescopeRepository.findDistinctInstruments(),
                telescopeRepository.findDistinctTelescopeIds(),
                telescopeRepository.findDistinctCameraTypes()));
    }

    @Override
    public List<Image> queryImages(final FieldPredicate<Image> predicate,
                                   final Telescope telescope,
                                   final LocalDate dayObs) {
        final Specification<ImageEntity> specification = Specification
                .where(Specifications.<ImageEntity, Image>matching(predicate))
                .and(Specifications.takenBy(telescope.telescopeId()))
                .and(Specifications.onNight(dayObs));

        return query("image query", status ->
                imageRepository.findAll(specification, Sort.by("dateObs", "id"))
                        .stream()
                        .map(ImageEntity::toImage)
                        .toList());
    }

    private <T> T query(final String operation, final TransactionCallback<T> callback) {
        try {
            return readOnly.execute(callback);
        } catch (final DataAccessException | TransactionException e) {
            log.error("Metadata store failure during {}: {}", operation, e.getMessage());
            throw new StoreUnavailableException(operation, e);
        }
    }
}
