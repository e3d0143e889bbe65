package fun.ai.functions.controller.apps;

import fun.ai.functions.common.AppConflictException;
import fun.ai.functions.common.AppHasRoutesException;
import fun.ai.functions.common.AppNotFoundException;
import fun.ai.functions.common.AppProvisioningException;
import fun.ai.functions.common.FunctionsApiException;
import fun.ai.functions.common.GlobalExceptionHandler;
import fun.ai.functions.entity.response.FnAppView;
import fun.ai.functions.service.AppLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class FnAppControllerTest {

    private AppLifecycleService appLifecycleService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        appLifecycleService = mock(AppLifecycleService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new FnAppController(appLifecycleService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void listWrapsAppsInEnvelope() throws Exception {
        when(appLifecycleService.list("p1")).thenReturn(List.of(view("billing-p1")));

        mockMvc.perform(get("/v1/p1/apps"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.apps[0].name").value("billing-p1"))
                .andExpect(jsonPath("$.apps[0].project_id").value("p1"))
                .andExpect(jsonPath("$.apps[0].error").doesNotExist())
                .andExpect(jsonPath("$.message").value("Successfully listed applications"));
    }

    @Test
    void createPassesNameAndDescription() throws Exception {
        when(appLifecycleService.create("p1", "billing", null)).thenReturn(view("billing-p1"));

        mockMvc.perform(post("/v1/p1/apps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"app\":{\"name\":\"billing\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.app.name").value("billing-p1"))
                .andExpect(jsonPath("$.message").value("App successfully created"));
    }

    @Test
    void createWithoutNameIsBadRequest() throws Exception {
        mockMvc.perform(post("/v1/p1/apps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"app\":{\"description\":\"x\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("app.name is required"));
        verify(appLifecycleService, never()).create(anyString(), any(), any());
    }

    @Test
    void createConflictIs409() throws Exception {
        when(appLifecycleService.create("p1", "billing", null)).thenThrow(new AppConflictException("billing-p1"));

        mockMvc.perform(post("/v1/p1/apps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"app\":{\"name\":\"billing\"}}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.message").value("App billing-p1 already exists"));
    }

    @Test
    void createProvisioningFailureIs500EvenWhenPlatformSaidOtherwise() throws Exception {
        when(appLifecycleService.create("p1", "billing", null)).thenThrow(new AppProvisioningException(
                "Unable to create app billing-p1: quota exceeded", new FunctionsApiException(429, "quota exceeded")));

        mockMvc.perform(post("/v1/p1/apps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"app\":{\"name\":\"billing\"}}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.message").value("Unable to create app billing-p1: quota exceeded"));
    }

    @Test
    void getMissingIs404() throws Exception {
        when(appLifecycleService.get("p1", "nope-p1")).thenThrow(new AppNotFoundException("nope-p1"));

        mockMvc.perform(get("/v1/p1/apps/nope-p1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.message").value("App nope-p1 not found"));
    }

    @Test
    void getRemoteFailureUsesPlatformStatus() throws Exception {
        when(appLifecycleService.get("p1", "billing-p1")).thenThrow(new FunctionsApiException(503, "platform busy"));

        mockMvc.perform(get("/v1/p1/apps/billing-p1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.message").value("platform busy"));
    }

    @Test
    void getRemoteFailureWithoutStatusIs500() throws Exception {
        when(appLifecycleService.get("p1", "billing-p1"))
                .thenThrow(new FunctionsApiException("functions request failed: connection refused", null));

        mockMvc.perform(get("/v1/p1/apps/billing-p1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.message").value("functions request failed: connection refused"));
    }

    @Test
    void updateForwardsWholeBody() throws Exception {
        Map<String, Object> fields = Map.of("config", Map.of("LEVEL", "debug"));
        when(appLifecycleService.update("p1", "billing-p1", fields)).thenReturn(view("billing-p1"));

        mockMvc.perform(put("/v1/p1/apps/billing-p1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"config\":{\"LEVEL\":\"debug\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.app.name").value("billing-p1"))
                .andExpect(jsonPath("$.message").value("App successfully updated"));
        verify(appLifecycleService).update("p1", "billing-p1", fields);
    }

    @Test
    void deleteReturnsMessageOnly() throws Exception {
        mockMvc.perform(delete("/v1/p1/apps/billing-p1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("App successfully deleted"))
                .andExpect(jsonPath("$.app").doesNotExist());
        verify(appLifecycleService).delete("p1", "billing-p1");
    }

    @Test
    void deleteWithRoutesIs403() throws Exception {
        doThrow(new AppHasRoutesException("billing-p1", 2)).when(appLifecycleService).delete("p1", "billing-p1");

        mockMvc.perform(delete("/v1/p1/apps/billing-p1"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.message").value("Unable to delete app billing-p1 with routes"));
    }

    private FnAppView view(String name) {
        FnAppView view = new FnAppView();
        view.setId(1L);
        view.setProjectId("p1");
        view.setName(name);
        view.setDescription("App for project p1");
        return view;
    }
}
