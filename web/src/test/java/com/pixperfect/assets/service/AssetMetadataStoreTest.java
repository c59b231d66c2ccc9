package com.pixperfect.assets.service;

import com.pixperfect.assets.common.model.Account;
import com.pixperfect.assets.common.model.ImageAsset;
import com.pixperfect.assets.common.repository.AccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(AssetMetadataStore.class)
class AssetMetadataStoreTest {

    @Autowired
    private AssetMetadataStore metadataStore;

    @Autowired
    private AccountRepository accountRepository;

    private Long alice;
    private Long bob;

    @BeforeEach
    void setUp() {
        alice = accountRepository.save(new Account("alice", "hash")).getId();
        bob = accountRepository.save(new Account("bob", "hash")).getId();
    }

    @Test
    void insertAssignsIdAndCreationTime() {
        ImageAsset saved = metadataStore.insert(alice, "k1-img.png", "{}", "{}");

        assertNotNull(saved.getId());
        assertNotNull(saved.getCreatedAt());
        assertEquals(alice, saved.getOwnerId());
    }

    @Test
    void getIsScopedToOwner() {
        Long id = metadataStore.insert(alice, "k1-img.png", "{}", "{}").getId();

        assertTrue(metadataStore.get(id, alice).isPresent());
        assertTrue(metadataStore.get(id, bob).isEmpty());
        assertTrue(metadataStore.get(id + 1000, alice).isEmpty());
    }

    @Test
    void listReturnsOnlyOwnersRowsInIdOrder() {
        Long first = metadataStore.insert(alice, "a.png", "{}", "{}").getId();
        metadataStore.insert(bob, "b.png", "{}", "{}");
        Long second = metadataStore.insert(alice, "c.png", "{}", "{}").getId();

        List<ImageAsset> assets = metadataStore.listByOwner(alice);

        assertEquals(2, assets.size());
        assertEquals(first, assets.get(0).getId());
        assertEquals(second, assets.get(1).getId());
        assertTrue(metadataStore.listByOwner(bob + 1000).isEmpty());
    }

    @Test
    void updateChangesOwnedRowOnly() {
        Long id = metadataStore.insert(alice, "old.png", "{}", "{}").getId();

        assertFalse(metadataStore.update(id, bob, "evil.png", "{}", "{}"));
        assertTrue(metadataStore.update(id, alice, "new.png", "{\"x\":1}", "{\"content\":\"hi\"}"));

        Optional<ImageAsset> reloaded = metadataStore.get(id, alice);
        assertTrue(reloaded.isPresent());
        assertEquals("new.png", reloaded.get().getStorageKey());
        assertEquals("{\"x\":1}", reloaded.get().getOverlayProps());
        assertEquals("{\"content\":\"hi\"}", reloaded.get().getTextOverlay());
    }

    @Test
    void deleteRemovesOwnedRowOnly() {
        Long id = metadataStore.insert(alice, "k1.png", "{}", "{}").getId();

        assertFalse(metadataStore.delete(id, bob));
        assertTrue(metadataStore.get(id, alice).isPresent());

        assertTrue(metadataStore.delete(id, alice));
        assertFalse(metadataStore.delete(id, alice));
        assertTrue(metadataStore.get(id, alice).isEmpty());
    }
}
