package org.springaicommunity.cluster.collector;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link KubeApiClient} - HTTP operations against the cluster API</li>
 * <li>{@link ArchiveService} - Archive creation</li>
 * <li>{@link ResourceSink} - Receiver of enumerated records</li>
 * </ul>
 *
 * <h3>Implementations</h3>
 * <ul>
 * <li>{@link KubeHttpClient} - Bearer token HTTP implementation</li>
 * <li>{@link RetryingKubeApiClient} - Retry decorator with exponential backoff</li>
 * <li>{@link TarGzArchiveService} - tar.gz archive creation</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Services → Interfaces (NOT concrete implementations)
 *   Decorators → Interface they decorate
 *   Enumeration → ResourceSink (NOT the writer)
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.cluster.collector",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule services_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("KubeHttpClient")
		.because("Services should depend on the KubeApiClient interface, not the concrete KubeHttpClient");

	@ArchTest
	static final ArchRule collection_service_should_not_depend_on_tar_gz_archive_service = noClasses().that()
		.haveSimpleNameEndingWith("CollectionService")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("TarGzArchiveService")
		.because("Collection services should depend on the ArchiveService interface");

	@ArchTest
	static final ArchRule collection_service_should_not_use_compression_directly = noClasses().that()
		.haveSimpleNameEndingWith("CollectionService")
		.should()
		.accessClassesThat()
		.resideInAPackage("org.apache.commons.compress..")
		.because("Collection services should use ArchiveService for archive operations");

	@ArchTest
	static final ArchRule enumerator_should_not_write_files = noClasses().that()
		.haveSimpleName("ClusterResourceEnumerator")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("OutputOrganizer")
		.because("The enumerator hands records to a ResourceSink and never writes output itself");

	// ========== Decorator Rules ==========

	@ArchTest
	static final ArchRule kube_api_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("KubeApiClient")
		.and()
		.doNotHaveSimpleName("KubeApiClient")
		.should()
		.implement(KubeApiClient.class)
		.because("All *KubeApiClient classes should implement the KubeApiClient interface");

	@ArchTest
	static final ArchRule decorators_should_not_depend_on_concrete_http_client = noClasses().that()
		.haveSimpleName("RetryingKubeApiClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("KubeHttpClient")
		.because("Decorators should depend on the KubeApiClient interface, not concrete implementation");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule archive_services_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("ArchiveService")
		.and()
		.doNotHaveSimpleName("ArchiveService")
		.should()
		.implement(ArchiveService.class)
		.because("All *ArchiveService classes should implement ArchiveService interface");

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Record")
		.or()
		.haveSimpleNameEndingWith("Result")
		.or()
		.haveSimpleNameEndingWith("Failure")
		.or()
		.haveSimpleNameEndingWith("Summary")
		.or()
		.haveSimpleNameEndingWith("Match")
		.or()
		.haveSimpleName("ResourceType")
		.or()
		.haveSimpleName("CollectionRun")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Model classes should be pure data without service dependencies");

	// ========== Service Layer Rules ==========

	@ArchTest
	static final ArchRule api_service_should_not_depend_on_collection_service = noClasses().that()
		.haveSimpleName("KubeApiService")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("CollectionService")
		.because("The cluster API service is lower-level than the collection service");

	@ArchTest
	static final ArchRule detection_should_not_depend_on_transport = noClasses().that()
		.haveSimpleName("ComponentDetectionEngine")
		.or()
		.haveSimpleName("DetectionFacts")
		.or()
		.haveSimpleName("ResourceSanitizer")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameStartingWith("Kube")
		.because("Detection and sanitization work on collected records only");

	@ArchTest
	static final ArchRule support_classes_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Utils")
		.or()
		.haveSimpleNameEndingWith("Parser")
		.should()
		.dependOnClassesThat()
		.haveNameMatching("org\\.springaicommunity\\.cluster\\.collector\\..*Service")
		.because("Support/utility classes should not depend on higher-level services");

	// ========== Builder/Configuration Rules ==========

	@ArchTest
	static final ArchRule only_builder_should_instantiate_concrete_implementations = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("TarGzArchiveService")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("RetryingKubeApiClient")
		.because("Only ClusterCollectorBuilder and the Spring configuration should create concrete implementations");

}
