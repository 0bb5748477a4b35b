package io.github.jakubt4.ithil.store;

import io.github.jakubt4.ithil.error.StoreUnavailableException;
import io.github.jakubt4.ithil.model.Telescope;
import io.github.jakubt4.ithil.selection.FieldPredicate;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JpaMetadataStoreFailureTest {

    private final TelescopeRepository telescopeRepository = mock(TelescopeRepository.class);
    private final ImageRepository imageRepository = mock(ImageRepository.class);
    private final PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);

    private final JpaMetadataStore store =
            new JpaMetadataStore(telescopeRepository, imageRepository, transactionManager);

    @Test
    @SuppressWarnings("unchecked")
    void dataAccessFailureSurfacesAsStoreUnavailable() {
        when(telescopeRepository.findAll(any(Specification.class), any(Sort.class)))
                .thenThrow(new DataAccessResourceFailureException("Communications link failure"));

        assertThatThrownBy(() -> store.queryTelescopes(FieldPredicate.always()))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("telescope query")
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void connectionFailureSurfacesAsStoreUnavailable() {
        when(transactionManager.getTransaction(any()))
                .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager"));

        assertThatThrownBy(() -> store.queryImages(FieldPredicate.always(),
                new Telescope("1m0-009", "lsc", "kb78", "SBig"), LocalDate.of(2015, 10, 1)))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("image query");
        assertThatThrownBy(store::queryDistinctTelescopeFields)
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("telescope discovery");
    }
}
