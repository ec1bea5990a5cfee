package org.nowstart.compass.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.compass.data.dto.ProposalDto;
import org.nowstart.compass.data.dto.ProposeRequest;
import org.nowstart.compass.data.dto.RankingDto;
import org.nowstart.compass.data.dto.RankingRequest;
import org.nowstart.compass.data.dto.StrategyDto;
import org.nowstart.compass.data.dto.StrategyLineageDto;
import org.nowstart.compass.data.dto.StrategyModification;
import org.nowstart.compass.data.entity.StrategyRecord;
import org.nowstart.compass.service.AdvisoryWorkflowService;
import org.nowstart.compass.service.RankingService;
import org.nowstart.compass.service.StrategyLifecycleService;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class StrategyControllerTest {

    @Mock
    private AdvisoryWorkflowService advisoryWorkflowService;

    @Mock
    private StrategyLifecycleService strategyLifecycleService;

    @Mock
    private RankingService rankingService;

    @InjectMocks
    private StrategyController controller;

    @Test
    void propose_returnsCreatedResponse() {
        ProposeRequest request = new ProposeRequest("goal-1", null, "us-equities", null, 7L);
        ProposalDto dto = mock(ProposalDto.class);
        when(advisoryWorkflowService.propose("user-1", request)).thenReturn(dto);

        var response = controller.propose("user-1", request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody()).isSameAs(dto);
    }

    @Test
    void fork_passesModificationThrough() {
        StrategyModification modification = new StrategyModification(Map.of("AAA", 0.5), null, null, null, "less AAA");
        ProposalDto dto = mock(ProposalDto.class);
        when(advisoryWorkflowService.fork("user-1", "s-1", 2, modification)).thenReturn(dto);

        var response = controller.fork("user-1", "s-1", 2, modification);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        verify(advisoryWorkflowService).fork("user-1", "s-1", 2, modification);
    }

    @Test
    void lineage_delegatesToService() {
        StrategyLineageDto dto = mock(StrategyLineageDto.class);
        when(strategyLifecycleService.lineage("user-1", "s-1")).thenReturn(dto);

        assertThat(controller.lineage("user-1", "s-1")).isSameAs(dto);
    }

    @Test
    void getVersion_mapsStoredRecord() {
        StrategyRecord strategy = mock(StrategyRecord.class);
        StrategyDto dto = mock(StrategyDto.class);
        when(strategyLifecycleService.get("user-1", "s-1", 1)).thenReturn(strategy);
        when(strategyLifecycleService.toDto(strategy)).thenReturn(dto);

        assertThat(controller.getVersion("user-1", "s-1", 1)).isSameAs(dto);
    }

    @Test
    void rank_delegatesToService() {
        RankingRequest request = new RankingRequest(List.of(new RankingRequest.StrategyRef("s-1", 1)));
        RankingDto dto = mock(RankingDto.class);
        when(rankingService.rank("user-1", request)).thenReturn(dto);

        assertThat(controller.rank("user-1", request)).isSameAs(dto);
        verify(rankingService).rank("user-1", request);
    }
}
