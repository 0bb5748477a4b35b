package io.github.jakubt4.ithil.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface TelescopeRepository extends JpaRepository<TelescopeEntity, Long>,
        JpaSpecificationExecutor<TelescopeEntity> {

    @Query("select distinct t.site from TelescopeEntity t order by t.site")
    List<String> findDistinctSites();

    @Query("select distinct t.instrument from TelescopeEntity t order by t.instrument")
    List<String> findDistinctInstruments();

    @Query("select distinct t.telescopeId from TelescopeEntity t order by t.telescopeId")
    List<String> findDistinctTelescopeIds();

    @Query("select distinct t.cameraType from TelescopeEntity t where t.cameraType is not null order by t.cameraType")
    List<String> findDistinctCameraTypes();
}
