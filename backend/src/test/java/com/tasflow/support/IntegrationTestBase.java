package com.tasflow.support;

import com.tasflow.ingest.MovieParser;
import com.tasflow.integration.VideoSync;
import com.tasflow.integration.WikiPages;
import com.tasflow.repository.GameSystemFrameRateRepository;
import com.tasflow.repository.PublicationRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Shared context for tests against the embedded database, with the collaborators
 * tests need to fail on demand replaced by mocks and spies.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class IntegrationTestBase {

    @MockBean
    protected MovieParser movieParser;

    @SpyBean
    protected WikiPages wikiPages;

    @SpyBean
    protected VideoSync videoSync;

    @SpyBean
    protected PublicationRepository publicationRepository;

    @SpyBean
    protected GameSystemFrameRateRepository frameRateRepository;

    @Autowired
    protected TestFixtures fixtures;

    @Autowired
    protected TransactionTemplate transactionTemplate;
}
