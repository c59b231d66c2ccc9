package com.pixperfect.assets.common.repository;

import com.pixperfect.assets.common.model.ImageAsset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Every query here is scoped by owner. There is deliberately no unscoped
 * lookup besides the inherited ones, which application code does not use.
 */
@Repository
public interface ImageAssetRepository extends JpaRepository<ImageAsset, Long> {

    Optional<ImageAsset> findByIdAndOwnerId(Long id, Long ownerId);

    List<ImageAsset> findAllByOwnerIdOrderByIdAsc(Long ownerId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE ImageAsset a SET a.storageKey = :storageKey, a.overlayProps = :overlayProps, "
            + "a.textOverlay = :textOverlay WHERE a.id = :id AND a.ownerId = :ownerId")
    int updateOwned(@Param("id") Long id,
                    @Param("ownerId") Long ownerId,
                    @Param("storageKey") String storageKey,
                    @Param("overlayProps") String overlayProps,
                    @Param("textOverlay") String textOverlay);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("DELETE FROM ImageAsset a WHERE a.id = :id AND a.ownerId = :ownerId")
    int deleteOwned(@Param("id") Long id, @Param("ownerId") Long ownerId);
}
