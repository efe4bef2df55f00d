package stackwatch.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** The resource types the watch engine knows about. */
public final class ResourceTypes {

  public static final String SERVERLESS_FUNCTION = "AWS::Serverless::Function";
  public static final String LAMBDA_FUNCTION = "AWS::Lambda::Function";
  public static final String SERVERLESS_LAYER_VERSION = "AWS::Serverless::LayerVersion";
  public static final String LAMBDA_LAYER_VERSION = "AWS::Lambda::LayerVersion";
  public static final String SERVERLESS_API = "AWS::Serverless::Api";
  public static final String APIGATEWAY_REST_API = "AWS::ApiGateway::RestApi";
  public static final String SERVERLESS_HTTP_API = "AWS::Serverless::HttpApi";
  public static final String APIGATEWAY_V2_API = "AWS::ApiGatewayV2::Api";
  public static final String SERVERLESS_STATE_MACHINE = "AWS::Serverless::StateMachine";
  public static final String STEPFUNCTIONS_STATE_MACHINE = "AWS::StepFunctions::StateMachine";
  public static final String SERVERLESS_APPLICATION = "AWS::Serverless::Application";
  public static final String CLOUDFORMATION_STACK = "AWS::CloudFormation::Stack";

  public static final String IMAGE_PACKAGE_TYPE = "Image";

  /** Resource type -> properties that can point at local files, in order of preference. */
  public static final Map<String, List<String>> RESOURCES_WITH_LOCAL_PATHS = ImmutableMap
    .<String, List<String>> builder()
    .put(SERVERLESS_FUNCTION, ImmutableList.of("CodeUri", "ImageUri"))
    .put(LAMBDA_FUNCTION, ImmutableList.of("Code"))
    .put(SERVERLESS_LAYER_VERSION, ImmutableList.of("ContentUri"))
    .put(LAMBDA_LAYER_VERSION, ImmutableList.of("Content"))
    .put(SERVERLESS_API, ImmutableList.of("DefinitionUri"))
    .put(APIGATEWAY_REST_API, ImmutableList.of("BodyS3Location"))
    .put(SERVERLESS_HTTP_API, ImmutableList.of("DefinitionUri"))
    .put(APIGATEWAY_V2_API, ImmutableList.of("BodyS3Location"))
    .put(SERVERLESS_STATE_MACHINE, ImmutableList.of("DefinitionUri"))
    .put(STEPFUNCTIONS_STATE_MACHINE, ImmutableList.of("DefinitionS3Location"))
    .put(SERVERLESS_APPLICATION, ImmutableList.of("Location"))
    .put(CLOUDFORMATION_STACK, ImmutableList.of("TemplateURL"))
    .build();

  /** Types that can be synced on their own, without a full infra sync. */
  public static final Set<String> CODE_SYNCABLE_RESOURCES = ImmutableSet.of(
    SERVERLESS_FUNCTION,
    LAMBDA_FUNCTION,
    SERVERLESS_LAYER_VERSION,
    LAMBDA_LAYER_VERSION,
    SERVERLESS_API,
    APIGATEWAY_REST_API,
    SERVERLESS_HTTP_API,
    APIGATEWAY_V2_API,
    SERVERLESS_STATE_MACHINE,
    STEPFUNCTIONS_STATE_MACHINE);

  private ResourceTypes() {
  }

  /** @return true if {@code value} is a local path rather than an S3/HTTP location or an intrinsic function */
  public static boolean isLocalPath(String value) {
    return !value.isEmpty() && !value.startsWith("s3://") && !value.startsWith("http://") && !value.startsWith("https://");
  }

}
