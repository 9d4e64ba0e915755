package com.simforge.orchestrator.stage.impl;

/**
 * Prompt text and tool schema for the planning stage.
 *
 * The same tool is used for initial planning and for refinement re-planning,
 * so a revised plan always comes back in the shape {@link PlanParser} reads.
 */
final class PlanningPrompts {

    private PlanningPrompts() {}

    static final String TOOL_NAME = "create_simulation_plan";

    static final String TOOL_DESCRIPTION =
            "Parse the user's simulation request into a structured plan with all necessary parameters";

    static final String SYSTEM = """
            You are an expert in physics simulations and Blender 3D animation.
            Your task is to turn user requests for simulations into structured plans.

            Guidelines:
            1. Identify the simulation type (rigid body, fluid smoke/fire/liquid, cloth, soft body).
            2. Extract every object mentioned, both active objects and static ground or obstacles.
            3. Infer reasonable defaults for unspecified parameters.
            4. Rigid body: default to 250 frames (10 seconds at 24 fps).
            5. Fluids: default to 150 frames.
            6. Cloth: default to 200 frames.
            7. Always include a static ground plane for falling objects.
            8. Material names: use simple terms (wood, metal, stone, rubber, glass, plastic, concrete, fabric).
            """;

    static final String INITIAL = """
            Parse this simulation request:
            "{{REQUEST}}"

            Examples of good plans:
            "20 wooden blocks falling on concrete floor"
              -> rigid_body, 20 cubes (wood), 1 plane (concrete, static), 250 frames
            "Smoke rising from a sphere"
              -> fluid_smoke, 1 sphere (emitter), 150 frames
            "Red cloth draped over a sphere"
              -> cloth, 1 plane (fabric), 1 sphere (static collision), 200 frames
            """;

    static final String REFINEMENT = """
            The simulation built from the plan below did not reach the required quality.

            Original request:
            "{{REQUEST}}"

            Previous plan:
            {{PLAN}}

            Quality feedback:
            {{FEEDBACK}}

            Produce a complete revised plan that addresses every issue in the feedback.
            Keep everything that was not criticised unchanged.
            """;

    static final String TOOL_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "simulation_type": {
                  "type": "string",
                  "enum": ["rigid_body", "fluid_smoke", "fluid_fire", "fluid_liquid", "cloth", "soft_body"],
                  "description": "Type of physics simulation"
                },
                "objects": {
                  "type": "array",
                  "description": "Objects in the simulation",
                  "items": {
                    "type": "object",
                    "properties": {
                      "name":        { "type": "string", "description": "Object name, e.g. 'wooden_block' or 'ground'" },
                      "object_type": { "type": "string", "enum": ["cube", "sphere", "cylinder", "cone", "plane", "torus", "monkey"] },
                      "count":       { "type": "integer", "minimum": 1, "maximum": 1000 },
                      "material":    { "type": "string", "description": "Material name (wood, metal, glass, ...)" },
                      "scale":       { "type": "number", "minimum": 0.1, "maximum": 100 },
                      "is_static":   { "type": "boolean", "description": "Static/passive object such as a ground plane" }
                    },
                    "required": ["name", "object_type", "count", "material"]
                  }
                },
                "duration_frames": {
                  "type": "integer", "minimum": 1, "maximum": 1000,
                  "description": "Animation length in frames (24 frames = 1 second)"
                },
                "physics_settings": {
                  "type": "object",
                  "properties": {
                    "gravity":            { "type": "number", "description": "m/s², negative pulls down" },
                    "substeps_per_frame": { "type": "integer", "minimum": 1, "maximum": 20 },
                    "solver_iterations":  { "type": "integer", "minimum": 1, "maximum": 100 },
                    "time_scale":         { "type": "number", "minimum": 0.1, "maximum": 10 },
                    "resolution_max":     { "type": "integer", "minimum": 32, "maximum": 512, "description": "Fluid simulations only" }
                  }
                }
              },
              "required": ["simulation_type", "objects", "duration_frames"]
            }
            """;
}
