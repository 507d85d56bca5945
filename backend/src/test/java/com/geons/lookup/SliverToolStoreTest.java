package com.geons.lookup;

import com.geons.domain.AddressFamily;
import com.geons.domain.SliverTool;
import com.geons.domain.SliverToolRepository;
import com.geons.lookup.config.LookupProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SliverToolStoreTest {

    @Mock
    SliverToolRepository sliverToolRepository;

    private SliverToolStore store;

    @BeforeEach
    void setUp() {
        LookupProperties props = new LookupProperties();
        props.setMaxFetchedResults(25);
        store = new SliverToolStore(sliverToolRepository, props);
    }

    @Test
    @DisplayName("query is capped at the configured maximum")
    void capsResults() {
        SliverTool t = new SliverTool();
        when(sliverToolRepository.findOnline("ndt", AddressFamily.IPV6, Set.of("lga01"), 25)).thenReturn(List.of(t));

        assertThat(store.loadOnline("ndt", AddressFamily.IPV6, Set.of("lga01"))).containsExactly(t);
    }

    @Test
    @DisplayName("data access failure becomes CandidateProviderException")
    void dataAccessFailureWrapped() {
        when(sliverToolRepository.findOnline(any(), any(), any(), anyInt()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> store.loadOnline("ndt", AddressFamily.IPV4, null))
                .isInstanceOf(CandidateProviderException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class)
                .hasMessageContaining("ndt");
    }

    @Test
    @DisplayName("full scan failure becomes CandidateProviderException")
    void scanFailureWrapped() {
        when(sliverToolRepository.findAll(any(Pageable.class))).thenThrow(new DataAccessResourceFailureException("timeout"));

        assertThatThrownBy(() -> store.loadAll()).isInstanceOf(CandidateProviderException.class);
    }

    @Test
    @DisplayName("full scan reads pages of the configured maximum until the last page")
    void scanIsPaged() {
        SliverTool a = new SliverTool();
        SliverTool b = new SliverTool();
        Sort byId = Sort.by("id");
        when(sliverToolRepository.findAll(any(Pageable.class))).thenReturn(
                new PageImpl<>(List.of(a), PageRequest.of(0, 25, byId), 26),
                new PageImpl<>(List.of(b), PageRequest.of(1, 25, byId), 26));

        assertThat(store.loadAll()).containsExactly(a, b);

        ArgumentCaptor<Pageable> pages = ArgumentCaptor.forClass(Pageable.class);
        verify(sliverToolRepository, times(2)).findAll(pages.capture());
        assertThat(pages.getAllValues()).extracting(Pageable::getPageSize).containsOnly(25);
        assertThat(pages.getAllValues()).extracting(Pageable::getPageNumber).containsExactly(0, 1);
        assertThat(pages.getValue().getSort()).isEqualTo(byId);
        verify(sliverToolRepository, never()).findAll();
    }
}
