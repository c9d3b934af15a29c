# Multi-stage Dockerfile for the polycopy service
# Usage: docker build -f deploy/Dockerfile.java -t polycopy/service .

ARG SERVICE=polycopy-service

# Stage 1: Build
FROM maven:3.9-amazoncorretto-17 AS builder
ARG SERVICE

WORKDIR /build

# Copy parent POM and all modules for dependency resolution
COPY pom.xml .
COPY polycopy-core/pom.xml polycopy-core/
COPY polycopy-service/pom.xml polycopy-service/

# Download dependencies (cached layer)
RUN mvn dependency:go-offline -B -pl ${SERVICE} -am

# Copy source code
COPY polycopy-core/src polycopy-core/src
COPY ${SERVICE}/src ${SERVICE}/src

# Build the service
RUN mvn package -DskipTests -pl ${SERVICE} -am

# Stage 2: Runtime
FROM amazoncorretto:17-alpine
ARG SERVICE

WORKDIR /app

COPY --from=builder /build/${SERVICE}/target/*.jar app.jar

ENV JAVA_OPTS="-Xmx512m -Xms256m"
ENV SPRING_PROFILES_ACTIVE=production

EXPOSE 8090

ENTRYPOINT ["sh", "-c", "java $JAVA_OPTS -jar app.jar"]
