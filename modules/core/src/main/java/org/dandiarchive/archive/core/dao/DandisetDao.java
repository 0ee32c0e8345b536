package org.dandiarchive.archive.core.dao;

import org.dandiarchive.archive.types.EmbargoStatus;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;

@RegisterConstructorMapper(DandisetRecord.class)
public interface DandisetDao {

    @SqlUpdate("INSERT INTO dandiset (embargo_status) VALUES (:embargoStatus)")
    @GetGeneratedKeys("id")
    long insert(@Bind("embargoStatus") EmbargoStatus embargoStatus);

    @SqlQuery("SELECT * FROM dandiset WHERE id = :id")
    Optional<DandisetRecord> findById(@Bind("id") long id);
}
