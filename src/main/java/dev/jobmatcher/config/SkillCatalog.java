package dev.jobmatcher.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Skill vocabulary used by the skill matcher. Pure data: lookups only.
 * <p>
 * {@link #SYNONYMS} is ordered; when an alias belongs to several canonical skills
 * (e.g. "node.js"), the first declared canonical owns it.
 */
public final class SkillCatalog {

    /**
     * Abbreviations expanded before synonym lookup.
     */
    public static final Map<String, String> ABBREVIATIONS = Map.of(
            "js", "javascript",
            "ts", "typescript",
            "py", "python",
            "k8s", "kubernetes",
            "aws", "amazon web services",
            "gcp", "google cloud platform",
            "ml", "machine learning",
            "ai", "artificial intelligence",
            "ci/cd", "continuous integration continuous deployment",
            "api", "application programming interface");

    public static final Map<String, List<String>> SYNONYMS;

    static {
        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        synonyms.put("javascript", List.of("js", "ecmascript", "node.js", "nodejs"));
        synonyms.put("typescript", List.of("ts"));
        synonyms.put("python", List.of("py"));
        synonyms.put("kubernetes", List.of("k8s"));
        synonyms.put("docker", List.of("containerization", "containers"));
        synonyms.put("aws", List.of("amazon web services", "amazon cloud"));
        synonyms.put("gcp", List.of("google cloud platform", "google cloud"));
        synonyms.put("azure", List.of("microsoft azure"));
        synonyms.put("postgresql", List.of("postgres", "psql"));
        synonyms.put("mongodb", List.of("mongo"));
        synonyms.put("react", List.of("reactjs", "react.js"));
        synonyms.put("angular", List.of("angularjs", "angular.js"));
        synonyms.put("vue", List.of("vuejs", "vue.js"));
        synonyms.put("machine learning", List.of("ml", "deep learning", "neural networks"));
        synonyms.put("artificial intelligence", List.of("ai"));
        synonyms.put("continuous integration", List.of("ci", "ci/cd"));
        synonyms.put("continuous deployment", List.of("cd", "ci/cd"));
        synonyms.put("node", List.of("nodejs", "node.js"));
        synonyms.put("express", List.of("expressjs", "express.js"));
        synonyms.put("next", List.of("nextjs", "next.js"));
        synonyms.put("mysql", List.of("sql"));
        synonyms.put("sql server", List.of("mssql"));
        synonyms.put("restful", List.of("rest", "rest api"));
        synonyms.put("graphql", List.of("gql"));
        SYNONYMS = Collections.unmodifiableMap(synonyms);
    }

    /**
     * Recognized technical terms, used only to pick skills out of free text.
     */
    public static final Set<String> TECH_VOCABULARY = Set.copyOf(List.of(
            // Languages
            "python", "java", "javascript", "typescript", "c++", "c#", "c", "ruby",
            "php", "go", "golang", "rust", "swift", "kotlin", "scala", "perl", "r",
            "matlab", "julia", "dart", "elixir", "haskell", "clojure", "objective-c",
            "groovy", "lua", "shell", "bash", "powershell", "vba", "cobol", "fortran",

            // Frontend
            "react", "reactjs", "react.js", "angular", "angularjs", "vue", "vuejs",
            "vue.js", "svelte", "next.js", "nextjs", "nuxt", "gatsby", "ember",
            "backbone", "jquery", "bootstrap", "tailwind", "material-ui", "mui",
            "ant design", "chakra ui", "sass", "scss", "less", "styled-components",
            "emotion", "redux", "mobx", "recoil", "zustand", "webpack", "vite",
            "rollup", "parcel", "babel", "eslint", "prettier", "jest", "cypress",
            "playwright", "selenium", "webdriver", "storybook",

            // Backend
            "node", "nodejs", "node.js", "express", "expressjs", "nestjs", "fastify",
            "koa", "django", "flask", "fastapi", "pyramid", "tornado", "spring",
            "spring boot", "springboot", "hibernate", "struts", "jsf", "play",
            "laravel", "symfony", "codeigniter", "yii", "rails", "ruby on rails",
            "sinatra", "asp.net", ".net", "dotnet", ".net core", "entity framework",
            "gin", "echo", "beego", "fiber", "actix", "rocket", "warp",

            // Mobile
            "react native", "flutter", "ionic", "xamarin", "cordova", "phonegap",
            "android", "ios", "swift ui", "jetpack compose", "kotlin multiplatform",

            // SQL
            "sql", "mysql", "postgresql", "postgres", "oracle", "sql server", "mssql",
            "sqlite", "mariadb", "db2", "teradata", "snowflake", "redshift",
            "bigquery", "aurora", "cockroachdb",

            // NoSQL
            "nosql", "mongodb", "cassandra", "couchdb", "dynamodb", "neo4j",
            "redis", "memcached", "elasticsearch", "solr", "firebase", "firestore",
            "realm", "couchbase", "hbase", "riak",

            // Cloud
            "aws", "amazon web services", "ec2", "s3", "lambda", "cloudformation",
            "cloudfront", "route53", "rds", "sqs", "sns", "kinesis",
            "azure", "microsoft azure", "azure devops", "gcp", "google cloud",
            "google cloud platform", "heroku", "digitalocean", "linode",
            "vultr", "cloudflare", "vercel", "netlify", "render",

            // DevOps
            "docker", "kubernetes", "k8s", "openshift", "rancher", "helm", "istio",
            "jenkins", "gitlab ci", "github actions", "circleci", "travis ci",
            "teamcity", "bamboo", "azure pipelines", "argo cd", "flux", "spinnaker",
            "terraform", "ansible", "puppet", "chef", "saltstack", "vagrant",
            "packer", "consul", "vault", "prometheus", "grafana", "datadog",
            "new relic", "splunk", "elk stack", "logstash", "kibana", "fluentd",

            // Version control
            "git", "github", "gitlab", "bitbucket", "svn", "mercurial", "perforce",
            "git flow", "trunk based development",

            // Testing
            "junit", "testng", "mockito", "pytest", "unittest", "nose",
            "mocha", "jasmine", "karma", "protractor", "cucumber", "behave", "rspec",
            "xunit", "nunit", "mstest", "postman", "insomnia", "jmeter", "gatling",
            "locust", "k6",

            // Messaging
            "kafka", "rabbitmq", "activemq", "zeromq", "nats", "pulsar", "mqtt",
            "redis pub/sub", "amazon sqs", "google pub/sub", "azure service bus",

            // APIs and protocols
            "rest", "restful", "graphql", "grpc", "soap", "websocket",
            "http", "https", "tcp", "udp", "oauth", "jwt", "saml", "openid",

            // Architecture
            "microservices", "monolith", "serverless", "event driven", "cqrs",
            "event sourcing", "domain driven design", "ddd", "clean architecture",
            "hexagonal architecture", "mvc", "mvvm", "mvp", "soa", "rest api",

            // ML / AI
            "machine learning", "ml", "deep learning", "neural networks", "cnn",
            "rnn", "lstm", "gru", "transformer", "bert", "gpt", "llm", "nlp",
            "computer vision", "opencv", "tensorflow", "pytorch", "keras",
            "scikit-learn", "sklearn", "xgboost", "lightgbm", "catboost",
            "pandas", "numpy", "scipy", "matplotlib", "seaborn", "plotly",
            "hugging face", "langchain", "llama", "stable diffusion", "yolo",

            // Data engineering
            "hadoop", "spark", "pyspark", "hive", "pig", "sqoop", "flume",
            "airflow", "luigi", "prefect", "dagster", "dbt", "databricks",
            "presto", "trino", "flink", "storm", "samza", "beam", "dataflow",

            // OS and tools
            "linux", "unix", "ubuntu", "centos", "rhel", "debian", "fedora",
            "windows", "macos", "vim", "emacs", "vscode",
            "intellij", "eclipse", "netbeans", "pycharm", "webstorm",

            // Practices
            "agile", "scrum", "kanban", "lean", "devops", "ci/cd", "tdd",
            "test driven development", "bdd", "behavior driven development",
            "pair programming", "code review", "solid", "design patterns",

            // Other
            "webscraping", "web scraping", "beautifulsoup", "scrapy",
            "nginx", "apache", "tomcat", "iis", "load balancing", "caching",
            "cdn", "oauth2", "authentication", "authorization", "encryption",
            "ssl", "tls", "vpn", "api gateway", "service mesh", "etl",
            "data warehouse", "data lake", "olap", "oltp", "indexing",
            "sharding", "replication", "partitioning", "normalization"));

    private SkillCatalog() {
    }
}
