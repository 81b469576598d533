package io.b2mash.lms;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TenantIsolationIntegrationTest {

  private static final String TENANT_HEADER = "x-tenant-id";

  @Container
  static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

  @DynamicPropertySource
  static void properties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.directory.jdbc-url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.directory.username", POSTGRES::getUsername);
    registry.add("spring.datasource.directory.password", POSTGRES::getPassword);
    registry.add("lms.tenancy.base-url", POSTGRES::getJdbcUrl);
    registry.add("lms.tenancy.username", POSTGRES::getUsername);
    registry.add("lms.tenancy.password", POSTGRES::getPassword);
    registry.add("lms.jwt.access-secret", () -> "integration-access-secret-at-least-32-bytes");
    registry.add("lms.jwt.refresh-secret", () -> "integration-refresh-secret-at-least-32-bytes");
    registry.add("lms.security.bcrypt-rounds", () -> "4");
  }

  @Autowired private MockMvc mockMvc;

  private String adminAccessToken;

  @BeforeAll
  void registerAdmin() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/auth/register")
                    .header(TENANT_HEADER, "acme")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"email": "admin@acme.test", "password": "correct-horse",
                         "firstName": "Ada", "lastName": "Admin", "roles": ["tenantAdmin"]}
                        """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.user.tenantId").value("acme"))
            .andReturn();
    adminAccessToken =
        JsonPath.read(result.getResponse().getContentAsString(), "$.tokens.accessToken");
  }

  @Test
  void instructorFlow_runsAgainstTenantDatabase() throws Exception {
    var instructor = register("instructor@acme.test", "Ian", "instructor");
    String instructorId = JsonPath.read(instructor, "$.user.id");
    String instructorToken = JsonPath.read(instructor, "$.tokens.accessToken");
    String studentId = JsonPath.read(register("student@acme.test", "Sam", "student"), "$.user.id");

    var course =
        mockMvc
            .perform(
                post("/api/tenant/courses")
                    .header(TENANT_HEADER, "acme")
                    .header("Authorization", "Bearer " + adminAccessToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"title": "Compilers", "instructorId": "%s"}
                        """
                            .formatted(instructorId)))
            .andExpect(status().isCreated())
            .andReturn();
    String courseId = JsonPath.read(course.getResponse().getContentAsString(), "$.id");

    var session =
        mockMvc
            .perform(
                post("/api/tenant/courses/" + courseId + "/sessions")
                    .header(TENANT_HEADER, "acme")
                    .header("Authorization", "Bearer " + instructorToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"userId": "%s", "sessionDate": "2030-01-15T10:00:00Z", "title": "Parsing"}
                        """
                            .formatted(instructorId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.userId").value(instructorId))
            .andReturn();
    String sessionId = JsonPath.read(session.getResponse().getContentAsString(), "$.id");

    mockMvc
        .perform(
            post("/api/tenant/sessions/" + sessionId + "/attendance")
                .header(TENANT_HEADER, "acme")
                .header("Authorization", "Bearer " + instructorToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"userId": "%s", "status": "PRESENT"}
                    """
                        .formatted(studentId)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.status").value("PRESENT"));

    mockMvc
        .perform(
            get("/api/tenant/courses")
                .header(TENANT_HEADER, "acme")
                .header("Authorization", "Bearer " + instructorToken))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(
            get("/api/tenant/courses/" + courseId + "/sessions")
                .header(TENANT_HEADER, "acme")
                .header("Authorization", "Bearer " + instructorToken))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(sessionId));
  }

  private String register(String email, String firstName, String role) throws Exception {
    return mockMvc
        .perform(
            post("/api/auth/register")
                .header(TENANT_HEADER, "acme")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "%s", "password": "correct-horse",
                     "firstName": "%s", "lastName": "Tester", "roles": ["%s"]}
                    """
                        .formatted(email, firstName, role)))
        .andExpect(status().isCreated())
        .andReturn()
        .getResponse()
        .getContentAsString();
  }

  @Test
  void login_fromOtherTenant_isForbidden() throws Exception {
    mockMvc
        .perform(
            post("/api/auth/login")
                .header(TENANT_HEADER, "globex")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "admin@acme.test", "password": "correct-horse"}
                    """))
        .andExpect(status().isForbidden());
  }

  @Test
  void login_wrongPassword_isUnauthorized() throws Exception {
    mockMvc
        .perform(
            post("/api/auth/login")
                .header(TENANT_HEADER, "acme")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "admin@acme.test", "password": "wrong-horse"}
                    """))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void courseCreatedInTenant_isReadableThere() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/tenant/courses")
                    .header(TENANT_HEADER, "acme")
                    .header("Authorization", "Bearer " + adminAccessToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"title": "Distributed Systems", "price": 1000}
                        """))
            .andExpect(status().isCreated())
            .andExpect(header().exists("Location"))
            .andExpect(jsonPath("$.tenantId").value("acme"))
            .andReturn();
    String courseId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");

    mockMvc
        .perform(
            get("/api/tenant/courses/" + courseId)
                .header(TENANT_HEADER, "acme")
                .header("Authorization", "Bearer " + adminAccessToken))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.title").value("Distributed Systems"));
  }

  @Test
  void tokenReplayedAgainstOtherTenant_isForbidden() throws Exception {
    mockMvc
        .perform(
            get("/api/tenant/courses")
                .header(TENANT_HEADER, "globex")
                .header("Authorization", "Bearer " + adminAccessToken))
        .andExpect(status().isForbidden());
  }

  @Test
  void tenantRoute_withoutToken_isUnauthorized() throws Exception {
    mockMvc
        .perform(get("/api/tenant/courses").header(TENANT_HEADER, "acme"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void tenantRoute_withoutTenantHeader_isRejected() throws Exception {
    mockMvc
        .perform(get("/api/tenant/courses").header("Authorization", "Bearer " + adminAccessToken))
        .andExpect(status().isBadRequest());
  }
}
