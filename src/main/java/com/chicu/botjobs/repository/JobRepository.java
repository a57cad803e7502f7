package com.chicu.botjobs.repository;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.domain.JobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JobRepository extends JpaRepository<JobEntity, String> {

    List<JobEntity> findByKindOrderByCreatedAtAscIdAsc(JobKind kind);

    List<JobEntity> findByKindAndOwnerOrderByCreatedAtAscIdAsc(JobKind kind, String owner);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from JobEntity j where j.id = :id")
    int deleteJobById(@Param("id") String id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from JobEntity j where j.kind = :kind")
    int deleteAllByKind(@Param("kind") JobKind kind);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from JobEntity j where j.kind = :kind and j.owner = :owner")
    int deleteAllByKindAndOwner(@Param("kind") JobKind kind, @Param("owner") String owner);
}
