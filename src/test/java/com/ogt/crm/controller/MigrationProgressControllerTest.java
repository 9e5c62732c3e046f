package com.ogt.crm.controller;

import com.ogt.crm.progress.ProgressBroadcaster;
import com.ogt.crm.progress.SseProgressObserver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MigrationProgressController.class)
class MigrationProgressControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProgressBroadcaster broadcaster;

    @Test
    void progressStreamRegistersAnSseObserver() throws Exception {
        mockMvc.perform(get("/api/migration/progress").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());

        verify(broadcaster).register(any(SseProgressObserver.class));
    }
}
